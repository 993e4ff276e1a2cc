package com.realm.generator.template;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * 共享属性池（attributes.json）
 */
@Data
public class AttributePool {

    /**
     * 品质等级，声明顺序即从低到高
     */
    private LinkedHashMap<String, Tier> quality = new LinkedHashMap<>();

    /**
     * 稀有度等级，声明顺序即从低到高
     */
    private LinkedHashMap<String, Tier> rarity = new LinkedHashMap<>();

    private List<String> materials = new ArrayList<>();

    /**
     * 属性名 → 取值区间
     */
    private LinkedHashMap<String, IntRange> stats = new LinkedHashMap<>();

    private List<String> damageTypes = new ArrayList<>();

    private List<String> tactileAdjectives = new ArrayList<>();

    private List<String> visualAdjectives = new ArrayList<>();

    private List<String> npcTraits = new ArrayList<>();

    private List<String> environmentTags = new ArrayList<>();
}
