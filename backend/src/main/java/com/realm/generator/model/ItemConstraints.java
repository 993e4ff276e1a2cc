package com.realm.generator.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * 物品生成约束
 *
 * 品质/稀有度按属性池中的声明顺序比较；没有品质（或稀有度）的物品不满足对应约束。
 * requiredStats 是追加保证：模板未产出的属性会被强制补上，而不是触发重抽。
 */
@Value
@Builder
@Jacksonized
public class ItemConstraints {

    public static final ItemConstraints NONE = ItemConstraints.builder().build();

    String minQuality;

    String maxQuality;

    String minRarity;

    String maxRarity;

    Integer minValue;

    Integer maxValue;

    @Builder.Default
    Set<String> excludedMaterials = Collections.emptySet();

    @Builder.Default
    List<String> requiredStats = Collections.emptyList();
}
