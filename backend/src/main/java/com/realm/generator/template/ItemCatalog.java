package com.realm.generator.template;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.List;

/**
 * items.json
 */
@Data
public class ItemCatalog {

    private LinkedHashMap<String, ItemTemplate> templates = new LinkedHashMap<>();

    /**
     * 物品集合名 → 模板名列表（职业库存、商店货架等）
     */
    private LinkedHashMap<String, List<String>> itemSets = new LinkedHashMap<>();
}
