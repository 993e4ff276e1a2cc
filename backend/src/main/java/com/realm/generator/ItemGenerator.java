package com.realm.generator;

import com.realm.common.GenerationExhaustedException;
import com.realm.generator.model.Item;
import com.realm.generator.model.ItemConstraints;
import com.realm.generator.template.AttributePool;
import com.realm.generator.template.IntRange;
import com.realm.generator.template.ItemTemplate;
import com.realm.generator.template.TemplateStore;
import org.apache.commons.lang3.StringUtils;
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
 * 物品生成器（带约束）
 *
 * 流程：选模板 → 抽品质/稀有度/材质/属性/伤害类型 → 计算价值 → 检查约束。
 * 不满足约束就重抽（未指定模板时允许换模板），最多 {@link #MAX_ATTEMPTS} 次，
 * 仍失败则抛出 {@link GenerationExhaustedException}。
 */
public class ItemGenerator {

    private static final Logger logger = LoggerFactory.getLogger(ItemGenerator.class);

    public static final int MAX_ATTEMPTS = 100;

    private final TemplateStore store;
    private final RandomSource random;

    public ItemGenerator(TemplateStore store, RandomSource random) {
        this.store = store;
        this.random = random;
    }

    public Item generate(String templateName, ItemConstraints constraints) {
        ItemConstraints rules = constraints != null ? constraints : ItemConstraints.NONE;
        validate(rules);
        if (templateName != null) {
            store.getItemTemplate(templateName);
        }

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            String chosen = templateName != null
                ? templateName
                : WeightedSelector.selectKey(random, store.getItemTemplates());
            Candidate candidate = sample(chosen, store.getItemTemplate(chosen));
            if (satisfies(candidate, rules)) {
                if (attempt > 1) {
                    logger.debug("第{}次尝试满足约束: template={}", attempt, chosen);
                }
                return candidate.toItem(requiredStats(candidate.stats, rules));
            }
        }

        logger.warn("物品生成耗尽重试次数: template={}, constraints={}", templateName, rules);
        throw new GenerationExhaustedException(MAX_ATTEMPTS, rules);
    }

    /**
     * 从物品集合中生成若干物品，count 为空时取 1..5
     */
    public List<Item> generateFromSet(String setName, Integer count) {
        List<String> templates = store.getItemSet(setName);
        int total = count != null ? count : random.randInt(1, 5);
        List<Item> items = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            items.add(generate(random.choice(templates), null));
        }
        return items;
    }

    private Candidate sample(String templateName, ItemTemplate template) {
        AttributePool attributes = store.getAttributes();

        String baseName = random.choice(template.getBaseNames());
        String quality = template.isHasQuality()
            ? WeightedSelector.selectKey(random, attributes.getQuality()) : null;
        String rarity = template.isHasRarity()
            ? WeightedSelector.selectKey(random, attributes.getRarity()) : null;
        String material = template.isHasMaterial() && !attributes.getMaterials().isEmpty()
            ? random.choice(attributes.getMaterials()) : null;

        int statCount = random.randInt(template.getStatCount().getMin(), template.getStatCount().getMax());
        Map<String, Integer> stats = randomStats(statCount);

        int baseValue = random.randInt(template.getValueRange().getMin(), template.getValueRange().getMax());
        double qualityMultiplier = quality != null ? store.getTier(TemplateStore.QUALITY, quality).getMultiplier() : 1.0;
        double rarityMultiplier = rarity != null ? store.getTier(TemplateStore.RARITY, rarity).getMultiplier() : 1.0;
        int value = Math.max(0, (int) Math.floor(baseValue * qualityMultiplier * rarityMultiplier));

        List<String> damageTypes = Collections.emptyList();
        IntRange damageCount = template.getDamageTypeCount();
        if (damageCount != null && !attributes.getDamageTypes().isEmpty()) {
            damageTypes = random.sample(attributes.getDamageTypes(),
                random.randInt(damageCount.getMin(), damageCount.getMax()));
        }

        List<String> nameParts = new ArrayList<>();
        if (quality != null) {
            nameParts.add(quality);
        }
        if (material != null) {
            nameParts.add(StringUtils.capitalize(material));
        }
        nameParts.add(baseName);

        String description = "";
        if (!template.getDescriptionTemplates().isEmpty()) {
            Map<String, Object> values = new LinkedHashMap<>();
            values.put("quality", quality != null ? quality.toLowerCase() : "");
            values.put("rarity", rarity != null ? rarity.toLowerCase() : "");
            values.put("material", material != null ? material : "");
            values.put("base_name", baseName.toLowerCase());
            values.put("tactile_adjective", pick(attributes.getTactileAdjectives()));
            values.put("visual_adjective", pick(attributes.getVisualAdjectives()));
            description = TemplateFiller.fill(random.choice(template.getDescriptionTemplates()), values);
        }

        Set<String> properties = new LinkedHashSet<>();
        if (template.isConsumable()) {
            properties.add(Item.CONSUMABLE);
        }
        if (template.isSingleUse()) {
            properties.add(Item.SINGLE_USE);
        }
        if (template.isProvidesDefense()) {
            properties.add(Item.PROVIDES_DEFENSE);
        }

        Candidate candidate = new Candidate();
        candidate.template = templateName;
        candidate.itemTemplate = template;
        candidate.name = String.join(" ", nameParts);
        candidate.quality = quality;
        candidate.rarity = rarity;
        candidate.material = material;
        candidate.stats = stats;
        candidate.damageTypes = damageTypes;
        candidate.value = value;
        candidate.description = description;
        candidate.properties = properties;
        return candidate;
    }

    private Map<String, Integer> randomStats(int count) {
        Map<String, IntRange> ranges = store.getAttributes().getStats();
        Map<String, Integer> stats = new LinkedHashMap<>();
        for (String stat : random.sample(ranges.keySet(), count)) {
            IntRange range = ranges.get(stat);
            int value = random.randInt(range.getMin(), range.getMax());
            if (value != 0) {
                stats.put(stat, value);
            }
        }
        return stats;
    }

    private boolean satisfies(Candidate candidate, ItemConstraints rules) {
        if (!withinTier(TemplateStore.QUALITY, candidate.quality, rules.getMinQuality(), rules.getMaxQuality())) {
            return false;
        }
        if (!withinTier(TemplateStore.RARITY, candidate.rarity, rules.getMinRarity(), rules.getMaxRarity())) {
            return false;
        }
        if (rules.getMinValue() != null && candidate.value < rules.getMinValue()) {
            return false;
        }
        if (rules.getMaxValue() != null && candidate.value > rules.getMaxValue()) {
            return false;
        }
        if (candidate.material != null && rules.getExcludedMaterials() != null) {
            for (String excluded : rules.getExcludedMaterials()) {
                if (candidate.material.equalsIgnoreCase(excluded)) {
                    return false;
                }
            }
        }
        return true;
    }

    private boolean withinTier(String pool, String tier, String min, String max) {
        if (min == null && max == null) {
            return true;
        }
        if (tier == null) {
            return false;
        }
        int ordinal = store.tierOrdinal(pool, tier);
        if (min != null && ordinal < store.tierOrdinal(pool, min)) {
            return false;
        }
        return max == null || ordinal <= store.tierOrdinal(pool, max);
    }

    /**
     * 补齐必需属性：模板没给出的属性在其区间内取一个非零值
     */
    private Map<String, Integer> requiredStats(Map<String, Integer> stats, ItemConstraints rules) {
        if (rules.getRequiredStats() == null || rules.getRequiredStats().isEmpty()) {
            return stats;
        }
        Map<String, Integer> result = new LinkedHashMap<>(stats);
        for (String required : rules.getRequiredStats()) {
            boolean present = result.keySet().stream().anyMatch(key -> key.equalsIgnoreCase(required));
            if (!present) {
                String stat = canonicalStat(required);
                result.put(stat, nonZeroValue(stat));
            }
        }
        return result;
    }

    private int nonZeroValue(String stat) {
        IntRange range = store.getStatRange(stat);
        List<Integer> values = new ArrayList<>();
        for (int v = range.getMin(); v <= range.getMax(); v++) {
            if (v != 0) {
                values.add(v);
            }
        }
        if (values.isEmpty()) {
            throw new IllegalArgumentException("属性区间没有非零取值: " + stat);
        }
        return random.choice(values);
    }

    private String canonicalStat(String name) {
        for (String stat : store.getAttributes().getStats().keySet()) {
            if (stat.equalsIgnoreCase(name)) {
                return stat;
            }
        }
        store.getStatRange(name);
        return name;
    }

    private void validate(ItemConstraints rules) {
        if (rules.getMinQuality() != null) {
            store.tierOrdinal(TemplateStore.QUALITY, rules.getMinQuality());
        }
        if (rules.getMaxQuality() != null) {
            store.tierOrdinal(TemplateStore.QUALITY, rules.getMaxQuality());
        }
        if (rules.getMinRarity() != null) {
            store.tierOrdinal(TemplateStore.RARITY, rules.getMinRarity());
        }
        if (rules.getMaxRarity() != null) {
            store.tierOrdinal(TemplateStore.RARITY, rules.getMaxRarity());
        }
        if (rules.getRequiredStats() != null) {
            for (String stat : rules.getRequiredStats()) {
                canonicalStat(stat);
            }
        }
    }

    private String pick(List<String> words) {
        return words.isEmpty() ? "" : random.choice(words);
    }

    private static final class Candidate {
        String template;
        ItemTemplate itemTemplate;
        String name;
        String quality;
        String rarity;
        String material;
        Map<String, Integer> stats;
        List<String> damageTypes;
        int value;
        String description;
        Set<String> properties;

        Item toItem(Map<String, Integer> finalStats) {
            return Item.builder()
                .name(name)
                .template(template)
                .type(itemTemplate.getType())
                .subtype(itemTemplate.getSubtype())
                .quality(quality)
                .rarity(rarity)
                .material(material)
                .stats(Collections.unmodifiableMap(finalStats))
                .damageTypes(Collections.unmodifiableList(damageTypes))
                .value(value)
                .description(description)
                .properties(Collections.unmodifiableSet(properties))
                .build();
        }
    }
}
