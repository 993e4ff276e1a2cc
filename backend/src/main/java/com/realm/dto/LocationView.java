package com.realm.dto;

import com.realm.generator.model.Weather;
import com.realm.simulation.entity.LivingLocation;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 模拟中地点的展示视图
 */
@Value
@Builder
public class LocationView {

    String id;
    String name;
    String type;
    String biome;

    /**
     * 相邻地点 id → 名称
     */
    Map<String, String> connections;

    List<String> npcIds;
    int itemCount;
    Weather weather;
    boolean marketOpen;

    public static LocationView of(LivingLocation location) {
        return LocationView.builder()
            .id(location.getId())
            .name(location.getName())
            .type(location.getType())
            .biome(location.getBiome())
            .connections(location.getConnections())
            .npcIds(new ArrayList<>(location.getNpcIds()))
            .itemCount(location.getItems().size())
            .weather(location.getCurrentWeather())
            .marketOpen(location.isMarketOpen())
            .build();
    }
}
