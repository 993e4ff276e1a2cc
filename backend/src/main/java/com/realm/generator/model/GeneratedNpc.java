package com.realm.generator.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * 生成的NPC静态档案，模拟中的动态字段在 LivingNpc 上
 */
@Value
@Builder
@Jacksonized
public class GeneratedNpc {

    String name;

    String title;

    /**
     * 职业标识，可为空列表（平民）
     */
    List<String> professions;

    String race;

    String faction;

    Map<String, Integer> stats;

    List<String> skills;

    String dialogue;

    String description;

    List<Item> inventory;

    public String primaryProfession() {
        return professions == null || professions.isEmpty() ? "wanderer" : professions.get(0);
    }
}
