package com.realm.generator.template;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.realm.common.TemplateNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.util.ResourceUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 模板库
 *
 * 预先加载的只读模板表：物品、职业、地点、生物群系、种族、阵营以及共享属性池。
 * 所有查找都是严格的，未知名称抛出 {@link TemplateNotFoundException}，不做替换。
 */
public class TemplateStore {

    private static final Logger logger = LoggerFactory.getLogger(TemplateStore.class);

    private static final String MARKER_FILE = "attributes.json";
    private static final Path[] FALLBACK_DIRS = new Path[] {
        Paths.get("data"),
        Paths.get("backend", "data")
    };

    public static final String QUALITY = "quality";
    public static final String RARITY = "rarity";

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final AttributePool attributes;
    private final ItemCatalog items;
    private final ProfessionCatalog professions;
    private final LinkedHashMap<String, RaceTemplate> races;
    private final LinkedHashMap<String, FactionTemplate> factions;
    private final LinkedHashMap<String, LocationTemplate> locations;
    private final LinkedHashMap<String, BiomeTemplate> biomes;

    public TemplateStore(AttributePool attributes, ItemCatalog items, ProfessionCatalog professions,
                         Map<String, RaceTemplate> races, Map<String, FactionTemplate> factions,
                         Map<String, LocationTemplate> locations, Map<String, BiomeTemplate> biomes) {
        this.attributes = attributes;
        this.items = items;
        this.professions = professions;
        this.races = new LinkedHashMap<>(races);
        this.factions = new LinkedHashMap<>(factions);
        this.locations = new LinkedHashMap<>(locations);
        this.biomes = new LinkedHashMap<>(biomes);
    }

    /**
     * 从 "classpath:data/" 或文件系统目录加载全部模板文件
     */
    public static TemplateStore load(String location) {
        return load(new DefaultResourceLoader(), location);
    }

    /**
     * 通过 ResourceLoader 解析模板目录，支持 classpath: 与 file: 前缀，
     * 无前缀按文件系统路径处理；目录不存在时依次尝试工程内的回退目录
     */
    public static TemplateStore load(ResourceLoader resourceLoader, String location) {
        Source source = resolve(resourceLoader, location);
        TemplateStore store = new TemplateStore(
            source.read("attributes.json", new TypeReference<AttributePool>() {}),
            source.read("items.json", new TypeReference<ItemCatalog>() {}),
            source.read("professions.json", new TypeReference<ProfessionCatalog>() {}),
            source.read("races.json", new TypeReference<LinkedHashMap<String, RaceTemplate>>() {}),
            source.read("factions.json", new TypeReference<LinkedHashMap<String, FactionTemplate>>() {}),
            source.read("locations.json", new TypeReference<LinkedHashMap<String, LocationTemplate>>() {}),
            source.read("biomes.json", new TypeReference<LinkedHashMap<String, BiomeTemplate>>() {})
        );
        logger.info("模板库加载完成: location={}, 物品模板={}, 职业={}, 地点模板={}, 种族={}, 生物群系={}",
            location, store.items.getTemplates().size(), store.professions.getProfessions().size(),
            store.locations.size(), store.races.size(), store.biomes.size());
        return store;
    }

    private static Source resolve(ResourceLoader resourceLoader, String location) {
        String root = location.startsWith(ResourceUtils.CLASSPATH_URL_PREFIX)
            || location.startsWith(ResourceUtils.FILE_URL_PREFIX)
            ? location
            : ResourceUtils.FILE_URL_PREFIX + location;
        if (!root.endsWith("/")) {
            root = root + "/";
        }
        String base = root;
        if (resourceLoader.getResource(base + MARKER_FILE).exists()) {
            return fileName -> resourceLoader.getResource(base + fileName);
        }
        logger.warn("模板目录不存在: {}，尝试回退目录", location);

        for (Path dir : FALLBACK_DIRS) {
            if (Files.exists(dir.resolve(MARKER_FILE))) {
                logger.info("使用回退模板目录: {}", dir.toAbsolutePath());
                return fileName -> new FileSystemResource(dir.resolve(fileName));
            }
        }
        throw new IllegalArgumentException("无法加载模板库: " + location);
    }

    @FunctionalInterface
    private interface Source {

        Resource resource(String fileName);

        default <T> T read(String fileName, TypeReference<T> type) {
            Resource resource = resource(fileName);
            if (!resource.exists()) {
                throw new IllegalArgumentException("模板文件缺失: " + fileName);
            }
            try (InputStream in = resource.getInputStream()) {
                return MAPPER.readValue(in, type);
            } catch (IOException e) {
                throw new UncheckedIOException("模板文件解析失败: " + fileName, e);
            }
        }
    }

    // ---------------------------------------------------------------- lookups

    public AttributePool getAttributes() {
        return attributes;
    }

    public ItemTemplate getItemTemplate(String name) {
        return require(items.getTemplates(), name, "物品模板");
    }

    public Map<String, ItemTemplate> getItemTemplates() {
        return items.getTemplates();
    }

    public List<String> getItemSet(String name) {
        return require(items.getItemSets(), name, "物品集合");
    }

    public ProfessionTemplate getProfession(String name) {
        return require(professions.getProfessions(), name, "职业");
    }

    public Map<String, ProfessionTemplate> getProfessions() {
        return professions.getProfessions();
    }

    public GenericNpcTemplate getGenericNpc() {
        return professions.getGeneric();
    }

    public RaceTemplate getRace(String name) {
        return require(races, name, "种族");
    }

    public Map<String, RaceTemplate> getRaces() {
        return races;
    }

    public FactionTemplate getFaction(String name) {
        return require(factions, name, "阵营");
    }

    public Map<String, FactionTemplate> getFactions() {
        return factions;
    }

    public LocationTemplate getLocationTemplate(String name) {
        return require(locations, name, "地点模板");
    }

    public Map<String, LocationTemplate> getLocationTemplates() {
        return locations;
    }

    public BiomeTemplate getBiome(String name) {
        return require(biomes, name, "生物群系");
    }

    public boolean hasBiome(String name) {
        return biomes.containsKey(name);
    }

    public IntRange getStatRange(String stat) {
        return require(attributes.getStats(), stat, "属性");
    }

    public Tier getTier(String pool, String tier) {
        return require(tierPool(pool), tier, pool + "等级");
    }

    /**
     * 等级在属性池声明顺序中的位置，用于约束比较
     */
    public int tierOrdinal(String pool, String tier) {
        List<String> order = new ArrayList<>(tierPool(pool).keySet());
        int index = order.indexOf(tier);
        if (index < 0) {
            throw new TemplateNotFoundException(pool + "等级", tier);
        }
        return index;
    }

    public LinkedHashMap<String, Tier> tierPool(String pool) {
        if (QUALITY.equals(pool)) {
            return attributes.getQuality();
        }
        if (RARITY.equals(pool)) {
            return attributes.getRarity();
        }
        throw new TemplateNotFoundException("等级池", pool);
    }

    private static <V> V require(Map<String, V> table, String name, String category) {
        V value = name != null ? table.get(name) : null;
        if (value == null) {
            throw new TemplateNotFoundException(category, name);
        }
        return value;
    }
}
