package com.realm.generator.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 生成的物品，生成后不可变
 */
@Value
@Builder
@Jacksonized
public class Item {

    public static final String CONSUMABLE = "consumable";
    public static final String SINGLE_USE = "single_use";
    public static final String PROVIDES_DEFENSE = "provides_defense";

    String name;

    /**
     * 生成所用的模板名
     */
    String template;

    String type;

    String subtype;

    String quality;

    String rarity;

    String material;

    /**
     * 属性修正，值为0的条目不出现
     */
    Map<String, Integer> stats;

    List<String> damageTypes;

    /**
     * 金币价值 = 基础价值 × 品质倍率 × 稀有度倍率（向下取整）
     */
    int value;

    String description;

    Set<String> properties;
}
