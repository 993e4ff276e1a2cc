package com.realm.generator.template;

import lombok.Data;

import java.util.LinkedHashMap;

@Data
public class BiomeTemplate {

    private String name;

    /**
     * spring / summer / autumn / winter
     */
    private LinkedHashMap<String, SeasonClimate> seasons = new LinkedHashMap<>();
}
