package com.realm.generator;

import com.realm.common.GenerationExhaustedException;
import com.realm.common.TemplateNotFoundException;
import com.realm.generator.model.Item;
import com.realm.generator.model.ItemConstraints;
import com.realm.generator.template.TemplateStore;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ItemGeneratorTest {

    private static TemplateStore store;

    @BeforeAll
    static void load() {
        store = TemplateStore.load("classpath:data/");
    }

    private static ContentGenerator generator(long seed) {
        return new ContentGenerator(store, seed);
    }

    @Test
    @DisplayName("同一种子生成完全相同的物品")
    void deterministicForSeed() {
        ContentGenerator first = generator(42L);
        ContentGenerator second = generator(42L);
        for (int i = 0; i < 20; i++) {
            assertThat(first.generateItem(null)).isEqualTo(second.generateItem(null));
        }
    }

    @Test
    @DisplayName("最低稀有度约束：1000次生成都不低于 Rare")
    void minRarityRespected() {
        ContentGenerator generator = generator(7L);
        ItemConstraints constraints = ItemConstraints.builder().minRarity("Rare").build();
        int rareOrdinal = store.tierOrdinal(TemplateStore.RARITY, "Rare");
        for (int i = 0; i < 1000; i++) {
            Item item = generator.generateItem("weapon_melee", constraints);
            assertThat(item.getRarity()).isNotNull();
            assertThat(store.tierOrdinal(TemplateStore.RARITY, item.getRarity())).isGreaterThanOrEqualTo(rareOrdinal);
        }
    }

    @Test
    @DisplayName("品质区间约束")
    void qualityWindowRespected() {
        ContentGenerator generator = generator(8L);
        ItemConstraints constraints = ItemConstraints.builder().minQuality("Fine").maxQuality("Superior").build();
        for (int i = 0; i < 200; i++) {
            assertThat(generator.generateItem("armor", constraints).getQuality()).isIn("Fine", "Superior");
        }
    }

    @Test
    @DisplayName("无稀有度的模板永远不满足稀有度约束")
    void itemsWithoutRarityNeverSatisfyRarityBound() {
        ItemConstraints constraints = ItemConstraints.builder().minRarity("Common").build();
        assertThatThrownBy(() -> generator(1L).generateItem("potion", constraints))
            .isInstanceOf(GenerationExhaustedException.class);
    }

    @Test
    @DisplayName("必需属性以非零值补入，名称大小写不敏感")
    void requiredStatsInserted() {
        ContentGenerator generator = generator(3L);
        ItemConstraints constraints = ItemConstraints.builder()
            .requiredStats(Arrays.asList("Luck", "speed"))
            .build();
        for (int i = 0; i < 100; i++) {
            Item item = generator.generateItem("potion", constraints);
            assertThat(item.getStats()).containsKeys("luck", "speed");
            assertThat(item.getStats().get("luck")).isNotZero();
            assertThat(item.getStats().get("speed")).isNotZero();
        }
    }

    @Test
    @DisplayName("排除的材质不会出现")
    void excludedMaterialsAvoided() {
        Set<String> excluded = new LinkedHashSet<>(Arrays.asList("iron", "steel", "bronze", "silver", "oak"));
        ItemConstraints constraints = ItemConstraints.builder().excludedMaterials(excluded).build();
        ContentGenerator generator = generator(5L);
        for (int i = 0; i < 200; i++) {
            assertThat(generator.generateItem("weapon_melee", constraints).getMaterial()).isNotIn(excluded);
        }
    }

    @Test
    @DisplayName("约束无法满足时重试耗尽")
    void exhaustionAfterMaxAttempts() {
        ItemConstraints constraints = ItemConstraints.builder().minValue(1_000_000).build();
        assertThatThrownBy(() -> generator(9L).generateItem("bread", constraints))
            .isInstanceOf(GenerationExhaustedException.class)
            .satisfies(e -> assertThat(((GenerationExhaustedException) e).getAttempts())
                .isEqualTo(ItemGenerator.MAX_ATTEMPTS));
    }

    @Test
    @DisplayName("未知的等级、属性或模板在抽样前报错")
    void unknownNamesFailFast() {
        ContentGenerator generator = generator(1L);
        assertThatThrownBy(() -> generator.generateItem("weapon_melee",
            ItemConstraints.builder().minQuality("Divine").build()))
            .isInstanceOf(TemplateNotFoundException.class);
        assertThatThrownBy(() -> generator.generateItem("weapon_melee",
            ItemConstraints.builder().requiredStats(Collections.singletonList("charm")).build()))
            .isInstanceOf(TemplateNotFoundException.class);
        assertThatThrownBy(() -> generator.generateItem("laser_rifle"))
            .isInstanceOf(TemplateNotFoundException.class);
    }

    @Test
    @DisplayName("名称、价值与属性标记按模板组合")
    void nameValueAndProperties() {
        ContentGenerator generator = generator(12L);
        for (int i = 0; i < 50; i++) {
            Item potion = generator.generateItem("potion");
            assertThat(potion.getMaterial()).isNull();
            assertThat(potion.getRarity()).isNull();
            assertThat(potion.getName()).startsWith(potion.getQuality() + " ");
            assertThat(potion.getProperties()).contains(Item.CONSUMABLE, Item.SINGLE_USE);
            assertThat(potion.getValue()).isBetween(2, 160);

            Item sword = generator.generateItem("weapon_melee");
            assertThat(sword.getDamageTypes()).hasSizeBetween(1, 2);
            assertThat(sword.getName()).contains(" " + Character.toUpperCase(sword.getMaterial().charAt(0)));
            assertThat(sword.getDescription()).isNotBlank().doesNotContain("{");
        }
    }

    @Test
    @DisplayName("物品集合生成")
    void generateFromSet() {
        ContentGenerator generator = generator(21L);
        List<Item> items = generator.generateItemsFromSet("blacksmith_goods", 4);
        assertThat(items).hasSize(4);
        assertThat(items).extracting(Item::getTemplate).allMatch(store.getItemSet("blacksmith_goods")::contains);

        assertThat(generator.generateItemsFromSet("alchemist_goods", null)).hasSizeBetween(1, 5);
        assertThatThrownBy(() -> generator.generateItemsFromSet("unknown_set", 1))
            .isInstanceOf(TemplateNotFoundException.class);
    }
}
