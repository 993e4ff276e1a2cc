package com.realm.generator.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * 生成的地点
 * connections: 邻居模板名 → 邻居地点ID，且总是双向的
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class GeneratedLocation {

    String id;

    String template;

    String name;

    String type;

    String biome;

    List<String> environmentTags;

    String description;

    List<GeneratedNpc> npcs;

    List<Item> items;

    Map<String, String> connections;
}
