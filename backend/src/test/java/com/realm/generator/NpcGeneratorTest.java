package com.realm.generator;

import com.realm.common.TemplateNotFoundException;
import com.realm.generator.model.GeneratedNpc;
import com.realm.generator.model.Item;
import com.realm.generator.template.TemplateStore;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NpcGeneratorTest {

    private static TemplateStore store;

    private ContentGenerator generator;

    @BeforeAll
    static void load() {
        store = TemplateStore.load("classpath:data/");
    }

    @BeforeEach
    void setUp() {
        generator = new ContentGenerator(store, 1234L);
    }

    @Test
    @DisplayName("多职业技能取并集且保持首次出现顺序")
    void skillsAreUnion() {
        GeneratedNpc npc = generator.generateNpc(Arrays.asList("blacksmith", "alchemist"), null, null);
        assertThat(npc.getSkills())
            .containsExactly("smithing", "metalworking", "haggling", "alchemy", "herbalism");
        assertThat(npc.getTitle()).isEqualTo("Blacksmith" + NpcGenerator.TITLE_SEPARATOR + "Alchemist");
        assertThat(npc.getProfessions()).containsExactly("blacksmith", "alchemist");
    }

    @Test
    @DisplayName("种族与阵营取自职业允许范围的并集")
    void raceAndFactionFromAllowedUnion() {
        for (int i = 0; i < 50; i++) {
            GeneratedNpc npc = generator.generateNpc(Arrays.asList("blacksmith", "alchemist"), null, null);
            assertThat(npc.getRace()).isIn("human", "dwarf", "elf", "gnome");
            assertThat(npc.getFaction()).isIn("merchants_guild", "city_watch", "arcane_circle");
        }
    }

    @Test
    @DisplayName("单职业属性为基础值加 ±1 抖动")
    void singleProfessionStatsJitter() {
        for (int i = 0; i < 50; i++) {
            GeneratedNpc npc = generator.generateNpc(Collections.singletonList("blacksmith"), "human", null);
            assertThat(npc.getStats().get("strength")).isBetween(13, 15);
            assertThat(npc.getStats().get("intelligence")).isBetween(7, 9);
            assertThat(npc.getStats().values()).allMatch(v -> v >= 1);
        }
    }

    @Test
    @DisplayName("种族修正叠加在平均值上")
    void raceModifiersApplied() {
        for (int i = 0; i < 50; i++) {
            GeneratedNpc npc = generator.generateNpc(Collections.singletonList("blacksmith"), "dwarf", null);
            // 13 + 2
            assertThat(npc.getStats().get("constitution")).isBetween(14, 16);
        }
    }

    @Test
    @DisplayName("职业库存来自职业的物品集合")
    void inventoryFromItemSet() {
        GeneratedNpc npc = generator.generateNpc(Collections.singletonList("blacksmith"), null, null);
        assertThat(npc.getInventory()).hasSizeBetween(1, 3);
        assertThat(npc.getInventory()).extracting(Item::getTemplate)
            .allMatch(store.getItemSet("blacksmith_goods")::contains);
        assertThat(store.getProfession("blacksmith").getDialogue()).contains(npc.getDialogue());
        assertThat(npc.getDescription()).contains(npc.getName());
    }

    @Test
    @DisplayName("空职业列表生成平民")
    void emptyProfessionsGiveCommoner() {
        GeneratedNpc npc = generator.generateNpc(Collections.emptyList(), "human", null);
        assertThat(npc.getTitle()).isEqualTo("Commoner");
        assertThat(npc.getProfessions()).isEmpty();
        assertThat(npc.getInventory()).isEmpty();
        assertThat(npc.getFaction()).isNull();
        assertThat(npc.getStats().get("strength")).isBetween(8, 12);
        assertThat(npc.primaryProfession()).isEqualTo("wanderer");
    }

    @Test
    @DisplayName("职业为空时随机抽取一个职业")
    void nullProfessionsDrawOne() {
        GeneratedNpc npc = generator.generateNpc(null, null, null);
        assertThat(npc.getProfessions()).hasSize(1);
        assertThat(store.getProfessions()).containsKey(npc.getProfessions().get(0));
    }

    @Test
    @DisplayName("未知的职业、种族或阵营抛出异常")
    void unknownNamesThrow() {
        assertThatThrownBy(() -> generator.generateNpc(Collections.singletonList("astronaut"), null, null))
            .isInstanceOf(TemplateNotFoundException.class);
        assertThatThrownBy(() -> generator.generateNpc(null, "dragon", null))
            .isInstanceOf(TemplateNotFoundException.class);
    }
}
