package com.realm.generator;

import com.realm.generator.model.GeneratedNpc;
import com.realm.generator.model.Item;
import com.realm.generator.template.FactionTemplate;
import com.realm.generator.template.GenericNpcTemplate;
import com.realm.generator.template.ProfessionTemplate;
import com.realm.generator.template.RaceTemplate;
import com.realm.generator.template.TemplateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * NPC生成器
 *
 * 多职业合成规则：
 * - 属性：各职业基础属性的算术平均（向下取整），再叠加种族修正，最后 ±1 抖动，下限 1
 * - 技能：并集去重，保持首次出现顺序
 * - 头衔：单职业直接取头衔，多职业用 " / " 连接
 * - 对话：在 NPC 的职业中均匀选一个，再取其一句对话
 * - 库存：每个带物品集合的职业贡献 1..3 件物品
 *
 * 职业列表为空时走平民路径（Commoner，±2 抖动，空库存）。
 */
public class NpcGenerator {

    private static final Logger logger = LoggerFactory.getLogger(NpcGenerator.class);

    public static final String TITLE_SEPARATOR = " / ";

    private final TemplateStore store;
    private final RandomSource random;
    private final ItemGenerator itemGenerator;

    public NpcGenerator(TemplateStore store, RandomSource random, ItemGenerator itemGenerator) {
        this.store = store;
        this.random = random;
        this.itemGenerator = itemGenerator;
    }

    /**
     * @param professions null 表示随机抽一个职业，空列表表示平民
     * @param race        固定种族，可为空
     * @param faction     固定阵营，可为空
     */
    public GeneratedNpc generate(List<String> professions, String race, String faction) {
        if (race != null) {
            store.getRace(race);
        }
        if (faction != null) {
            store.getFaction(faction);
        }

        List<String> chosen = professions != null
            ? new ArrayList<>(professions)
            : Collections.singletonList(WeightedSelector.selectKey(random, store.getProfessions()));

        if (chosen.isEmpty()) {
            return generic(race, faction);
        }

        List<ProfessionTemplate> templates = new ArrayList<>(chosen.size());
        for (String profession : chosen) {
            templates.add(store.getProfession(profession));
        }

        String raceName = race != null ? race : pickRace(templates);
        String factionName = faction != null ? faction : pickFaction(templates);
        RaceTemplate raceTemplate = store.getRace(raceName);

        Map<String, Integer> stats = averageStats(templates);
        applyRace(stats, raceTemplate);
        jitter(stats, 1);

        Set<String> skills = new LinkedHashSet<>();
        for (ProfessionTemplate template : templates) {
            skills.addAll(template.getSkills());
        }

        List<String> titles = new ArrayList<>();
        for (ProfessionTemplate template : templates) {
            titles.add(template.getTitle());
        }
        String title = String.join(TITLE_SEPARATOR, titles);

        String name = randomName(raceTemplate);
        ProfessionTemplate speaker = random.choice(templates);
        String dialogue = pick(speaker.getDialogue());

        ProfessionTemplate primary = templates.get(0);
        String description = describe(primary.getDescriptionTemplates(), name, raceTemplate, title, primary.getTitle());

        List<Item> inventory = new ArrayList<>();
        for (ProfessionTemplate template : templates) {
            if (template.getItemSet() != null) {
                inventory.addAll(itemGenerator.generateFromSet(template.getItemSet(), random.randInt(1, 3)));
            }
        }

        logger.debug("生成NPC: name={}, professions={}, race={}", name, chosen, raceName);
        return GeneratedNpc.builder()
            .name(name)
            .title(title)
            .professions(Collections.unmodifiableList(chosen))
            .race(raceName)
            .faction(factionName)
            .stats(Collections.unmodifiableMap(stats))
            .skills(Collections.unmodifiableList(new ArrayList<>(skills)))
            .dialogue(dialogue)
            .description(description)
            .inventory(Collections.unmodifiableList(inventory))
            .build();
    }

    private GeneratedNpc generic(String race, String faction) {
        GenericNpcTemplate template = store.getGenericNpc();
        String raceName = race != null ? race : WeightedSelector.selectKey(random, store.getRaces());
        RaceTemplate raceTemplate = store.getRace(raceName);

        Map<String, Integer> stats = new LinkedHashMap<>(template.getBaseStats());
        applyRace(stats, raceTemplate);
        jitter(stats, 2);

        String name = randomName(raceTemplate);
        String dialogue = pick(template.getDialogue());
        String description = describe(template.getDescriptionTemplates(), name, raceTemplate,
            template.getTitle(), template.getTitle());

        return GeneratedNpc.builder()
            .name(name)
            .title(template.getTitle())
            .professions(Collections.emptyList())
            .race(raceName)
            .faction(faction)
            .stats(Collections.unmodifiableMap(stats))
            .skills(Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(template.getSkills()))))
            .dialogue(dialogue)
            .description(description)
            .inventory(Collections.emptyList())
            .build();
    }

    /**
     * 每项属性只在定义了它的职业之间取平均
     */
    private Map<String, Integer> averageStats(List<ProfessionTemplate> templates) {
        Map<String, int[]> totals = new LinkedHashMap<>();
        for (ProfessionTemplate template : templates) {
            for (Map.Entry<String, Integer> entry : template.getBaseStats().entrySet()) {
                int[] acc = totals.computeIfAbsent(entry.getKey(), k -> new int[2]);
                acc[0] += entry.getValue();
                acc[1]++;
            }
        }
        Map<String, Integer> stats = new LinkedHashMap<>();
        totals.forEach((stat, acc) -> stats.put(stat, Math.floorDiv(acc[0], acc[1])));
        return stats;
    }

    private void applyRace(Map<String, Integer> stats, RaceTemplate race) {
        race.getStatModifiers().forEach((stat, modifier) -> stats.merge(stat, modifier, Integer::sum));
    }

    private void jitter(Map<String, Integer> stats, int spread) {
        for (Map.Entry<String, Integer> entry : stats.entrySet()) {
            entry.setValue(Math.max(1, entry.getValue() + random.randInt(-spread, spread)));
        }
    }

    private String pickRace(List<ProfessionTemplate> templates) {
        Set<String> allowed = new LinkedHashSet<>();
        for (ProfessionTemplate template : templates) {
            allowed.addAll(template.getAllowedRaces());
        }
        if (allowed.isEmpty()) {
            return WeightedSelector.selectKey(random, store.getRaces());
        }
        List<String> options = new ArrayList<>(allowed);
        return WeightedSelector.select(random, options, name -> store.getRace(name).effectiveWeight());
    }

    private String pickFaction(List<ProfessionTemplate> templates) {
        Set<String> allowed = new LinkedHashSet<>();
        for (ProfessionTemplate template : templates) {
            allowed.addAll(template.getAllowedFactions());
        }
        if (allowed.isEmpty()) {
            return null;
        }
        List<String> options = new ArrayList<>(allowed);
        return WeightedSelector.select(random, options, name -> {
            FactionTemplate faction = store.getFaction(name);
            return faction.effectiveWeight();
        });
    }

    private String randomName(RaceTemplate race) {
        String first = pick(race.getFirstNames());
        String last = pick(race.getLastNames());
        return (first + " " + last).trim();
    }

    private String describe(List<String> templates, String name, RaceTemplate race, String title, String profession) {
        if (templates.isEmpty()) {
            return "";
        }
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("name", name);
        values.put("race", race.getName() != null ? race.getName() : "");
        values.put("title", title);
        values.put("profession", profession.toLowerCase());
        values.put("trait", pick(store.getAttributes().getNpcTraits()));
        return TemplateFiller.fill(random.choice(templates), values);
    }

    private String pick(List<String> options) {
        return options.isEmpty() ? "" : random.choice(options);
    }
}
