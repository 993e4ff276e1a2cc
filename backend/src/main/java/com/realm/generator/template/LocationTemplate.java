package com.realm.generator.template;

import com.realm.generator.Weighted;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class LocationTemplate implements Weighted {

    private String name;

    private String type;

    private Double weight;

    private List<String> suitableBiomes = new ArrayList<>();

    private List<String> baseEnvironmentTags = new ArrayList<>();

    private IntRange additionalTagsCount = new IntRange(0, 0);

    private List<String> descriptionTemplates = new ArrayList<>();

    private IntRange npcSpawnCount = new IntRange(0, 0);

    private List<String> spawnableProfessions = new ArrayList<>();

    private IntRange itemSpawnCount = new IntRange(0, 0);

    private List<String> spawnableItems = new ArrayList<>();

    /**
     * 允许相连的邻居模板名
     */
    private List<String> canConnectTo = new ArrayList<>();
}
