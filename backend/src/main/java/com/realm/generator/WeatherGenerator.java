package com.realm.generator;

import com.realm.generator.model.Weather;
import com.realm.generator.template.BiomeTemplate;
import com.realm.generator.template.SeasonClimate;
import com.realm.generator.template.TemplateStore;

import java.util.HashMap;
import java.util.Map;

/**
 * 天气生成：按生物群系的季节气候加权抽取天气，温度再按时段偏移
 */
public class WeatherGenerator {

    public static final String DEFAULT_CONDITION = "clear";

    private static final Map<String, Integer> TIME_OFFSETS = new HashMap<>();

    static {
        TIME_OFFSETS.put("night", -6);
        TIME_OFFSETS.put("dawn", -3);
        TIME_OFFSETS.put("morning", 0);
        TIME_OFFSETS.put("afternoon", 3);
        TIME_OFFSETS.put("dusk", 0);
        TIME_OFFSETS.put("evening", -2);
    }

    private final TemplateStore store;
    private final RandomSource random;

    public WeatherGenerator(TemplateStore store, RandomSource random) {
        this.store = store;
        this.random = random;
    }

    /**
     * @param season    spring / summer / autumn / winter
     * @param timeOfDay night / dawn / morning / afternoon / dusk / evening
     */
    public Weather generate(String biome, String season, String timeOfDay) {
        BiomeTemplate template = store.getBiome(biome);
        SeasonClimate climate = template.getSeasons().get(season);
        if (climate == null) {
            throw new IllegalArgumentException("生物群系 " + biome + " 没有季节配置: " + season);
        }

        String condition = climate.getConditions().isEmpty()
            ? DEFAULT_CONDITION
            : WeightedSelector.selectName(random, climate.getConditions());
        int temperature = random.randInt(climate.getTemperature().getMin(), climate.getTemperature().getMax())
            + TIME_OFFSETS.getOrDefault(timeOfDay, 0);

        return Weather.builder()
            .condition(condition)
            .temperature(temperature)
            .season(season)
            .timeOfDay(timeOfDay)
            .build();
    }
}
