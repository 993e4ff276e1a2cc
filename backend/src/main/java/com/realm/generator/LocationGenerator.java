package com.realm.generator;

import com.realm.generator.model.GeneratedLocation;
import com.realm.generator.model.GeneratedNpc;
import com.realm.generator.model.GeneratedWorld;
import com.realm.generator.model.Item;
import com.realm.generator.template.IntRange;
import com.realm.generator.template.LocationTemplate;
import com.realm.generator.template.TemplateStore;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 地点与世界图生成器
 *
 * 两阶段构建：先把节点生成进 {@link WorldGraph}，再按深度计数逐层分配边。
 * 深度达到 {@link #MAX_CONNECTION_DEPTH} 的节点不再向外连接，
 * 因此新生成的邻居本身不会继续扩展。
 */
public class LocationGenerator {

    private static final Logger logger = LoggerFactory.getLogger(LocationGenerator.class);

    public static final int MAX_CONNECTION_DEPTH = 1;
    public static final int DEFAULT_MAX_CONNECTIONS = 3;
    public static final int WORLD_MAX_CONNECTIONS = 2;
    public static final double REUSE_CHANCE = 0.5;
    public static final String FALLBACK_BIOME = "temperate_forest";

    private final TemplateStore store;
    private final RandomSource random;
    private final NpcGenerator npcGenerator;
    private final ItemGenerator itemGenerator;
    private final WorldGraph graph;

    public LocationGenerator(TemplateStore store, RandomSource random,
                             NpcGenerator npcGenerator, ItemGenerator itemGenerator, WorldGraph graph) {
        this.store = store;
        this.random = random;
        this.npcGenerator = npcGenerator;
        this.itemGenerator = itemGenerator;
        this.graph = graph;
    }

    /**
     * 生成单个地点
     *
     * @param templateName   为空时按权重随机
     * @param connect        是否生成连接
     * @param maxConnections 连接数上限
     * @param biome          为空时从模板适用群系中选
     */
    public GeneratedLocation generate(String templateName, boolean connect, int maxConnections, String biome) {
        String rootId = createNode(templateName, biome, connect ? 0 : MAX_CONNECTION_DEPTH);
        connect(rootId, maxConnections);
        return graph.get(rootId);
    }

    /**
     * 清空会话图，生成 count 个根地点（每个最多 2 条连接），汇总最终图
     */
    public GeneratedWorld generateWorld(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("地点数量不能为负: " + count);
        }
        graph.clear();
        for (int i = 0; i < count; i++) {
            generate(null, true, WORLD_MAX_CONNECTIONS, null);
        }
        logger.info("世界生成完成: 根地点={}, 地点总数={}", count, graph.size());
        return GeneratedWorld.builder()
            .locations(Collections.unmodifiableMap(graph.locations()))
            .summary(Collections.unmodifiableMap(graph.summary()))
            .build();
    }

    // ---------------------------------------------------------------- phase 2: edges

    private void connect(String rootId, int maxConnections) {
        Deque<String> pending = new ArrayDeque<>();
        pending.add(rootId);
        while (!pending.isEmpty()) {
            String id = pending.poll();
            int depth = graph.depthOf(id);
            if (depth >= MAX_CONNECTION_DEPTH) {
                continue;
            }
            LocationTemplate template = store.getLocationTemplate(graph.templateOf(id));
            int available = Math.min(maxConnections, template.getCanConnectTo().size());
            if (available < 1) {
                continue;
            }
            List<String> slots = random.sample(template.getCanConnectTo(), random.randInt(1, available));
            for (String slot : slots) {
                if (graph.hasSlot(id, slot)) {
                    continue;
                }
                List<String> candidates = graph.reusable(id, slot);
                String neighbour;
                if (!candidates.isEmpty() && random.chance(REUSE_CHANCE)) {
                    neighbour = random.choice(candidates);
                    logger.debug("复用已有地点: {} -> {}", id, neighbour);
                } else {
                    neighbour = createNode(slot, null, depth + 1);
                    pending.add(neighbour);
                }
                graph.link(id, neighbour);
            }
        }
    }

    // ---------------------------------------------------------------- phase 1: nodes

    private String createNode(String templateName, String biome, int depth) {
        String chosen = templateName != null
            ? templateName
            : WeightedSelector.selectKey(random, store.getLocationTemplates());
        LocationTemplate template = store.getLocationTemplate(chosen);

        String biomeName = resolveBiome(template, biome);
        String id = uniqueId(chosen);
        List<String> tags = environmentTags(template);
        String name = StringUtils.defaultIfBlank(template.getName(), chosen);

        String description = "";
        if (!template.getDescriptionTemplates().isEmpty()) {
            Map<String, Object> values = new LinkedHashMap<>();
            values.put("name", name);
            values.put("biome", biomeName.replace('_', ' '));
            values.put("visual_adjective", pick(store.getAttributes().getVisualAdjectives()));
            values.put("tactile_adjective", pick(store.getAttributes().getTactileAdjectives()));
            for (int i = 0; i < tags.size(); i++) {
                values.put("environment_tag_" + (i + 1), tags.get(i));
            }
            description = TemplateFiller.fill(random.choice(template.getDescriptionTemplates()), values);
        }

        List<GeneratedNpc> npcs = new ArrayList<>();
        int npcCount = count(template.getNpcSpawnCount());
        for (int i = 0; i < npcCount; i++) {
            List<String> professions = template.getSpawnableProfessions().isEmpty()
                ? Collections.emptyList()
                : Collections.singletonList(random.choice(template.getSpawnableProfessions()));
            npcs.add(npcGenerator.generate(professions, null, null));
        }

        List<Item> items = new ArrayList<>();
        if (!template.getSpawnableItems().isEmpty()) {
            int itemCount = count(template.getItemSpawnCount());
            for (int i = 0; i < itemCount; i++) {
                items.add(itemGenerator.generate(random.choice(template.getSpawnableItems()), null));
            }
        }

        GeneratedLocation location = GeneratedLocation.builder()
            .id(id)
            .template(chosen)
            .name(name)
            .type(template.getType())
            .biome(biomeName)
            .environmentTags(Collections.unmodifiableList(tags))
            .description(description)
            .npcs(Collections.unmodifiableList(npcs))
            .items(Collections.unmodifiableList(items))
            .connections(Collections.emptyMap())
            .build();
        graph.add(location, depth);
        logger.debug("生成地点: id={}, biome={}, depth={}", id, biomeName, depth);
        return id;
    }

    private String resolveBiome(LocationTemplate template, String biome) {
        if (biome != null) {
            store.getBiome(biome);
            return biome;
        }
        if (!template.getSuitableBiomes().isEmpty()) {
            return random.choice(template.getSuitableBiomes());
        }
        return FALLBACK_BIOME;
    }

    private String uniqueId(String templateName) {
        String id;
        do {
            id = templateName + "_" + random.randInt(1000, 9999);
        } while (graph.contains(id));
        return id;
    }

    private List<String> environmentTags(LocationTemplate template) {
        Set<String> tags = new LinkedHashSet<>(template.getBaseEnvironmentTags());
        List<String> extras = new ArrayList<>(store.getAttributes().getEnvironmentTags());
        extras.removeAll(tags);
        tags.addAll(random.sample(extras, count(template.getAdditionalTagsCount())));
        return new ArrayList<>(tags);
    }

    private int count(IntRange range) {
        return range == null ? 0 : random.randInt(range.getMin(), range.getMax());
    }

    private String pick(List<String> options) {
        return options.isEmpty() ? "" : random.choice(options);
    }
}
