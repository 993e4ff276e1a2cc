package com.realm.generator;

import com.realm.generator.model.GeneratedLocation;
import com.realm.generator.model.GeneratedNpc;
import com.realm.generator.model.GeneratedWorld;
import com.realm.generator.model.Item;
import com.realm.generator.model.ItemConstraints;
import com.realm.generator.model.Weather;
import com.realm.generator.template.TemplateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 内容生成门面
 *
 * 持有唯一的随机源和会话地点图，所有生成调用都经由这里。
 * 同一种子、同样顺序的调用得到完全一致的结果；可以在一个进程中构造多个实例。
 */
public class ContentGenerator {

    private static final Logger logger = LoggerFactory.getLogger(ContentGenerator.class);

    private final TemplateStore templates;
    private final RandomSource random;
    private final WorldGraph graph = new WorldGraph();
    private final ItemGenerator items;
    private final NpcGenerator npcs;
    private final LocationGenerator locations;
    private final WeatherGenerator weather;

    public ContentGenerator(TemplateStore templates, RandomSource random) {
        this.templates = templates;
        this.random = random;
        this.items = new ItemGenerator(templates, random);
        this.npcs = new NpcGenerator(templates, random, items);
        this.locations = new LocationGenerator(templates, random, npcs, items, graph);
        this.weather = new WeatherGenerator(templates, random);
        logger.info("内容生成器已创建: seed={}", random.getSeed());
    }

    public ContentGenerator(TemplateStore templates, Long seed) {
        this(templates, RandomSource.fromSeed(seed));
    }

    public Item generateItem(String template, ItemConstraints constraints) {
        return items.generate(template, constraints);
    }

    public Item generateItem(String template) {
        return items.generate(template, null);
    }

    public List<Item> generateItemsFromSet(String setName, Integer count) {
        return items.generateFromSet(setName, count);
    }

    public GeneratedNpc generateNpc(List<String> professions, String race, String faction) {
        return npcs.generate(professions, race, faction);
    }

    public GeneratedLocation generateLocation(String template, boolean connect, int maxConnections, String biome) {
        return locations.generate(template, connect, maxConnections, biome);
    }

    public GeneratedLocation generateLocation(String template) {
        return locations.generate(template, true, LocationGenerator.DEFAULT_MAX_CONNECTIONS, null);
    }

    public GeneratedWorld generateWorld(int count) {
        return locations.generateWorld(count);
    }

    public Weather generateWeather(String biome, String season, String timeOfDay) {
        return weather.generate(biome, season, timeOfDay);
    }

    public TemplateStore getTemplates() {
        return templates;
    }

    public RandomSource getRandom() {
        return random;
    }

    public WorldGraph getGraph() {
        return graph;
    }
}
