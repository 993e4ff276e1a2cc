package com.realm.generator.template;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * 无职业平民的生成参数
 */
@Data
public class GenericNpcTemplate {

    private String title = "Commoner";

    private LinkedHashMap<String, Integer> baseStats = new LinkedHashMap<>();

    private List<String> skills = new ArrayList<>();

    private List<String> dialogue = new ArrayList<>();

    private List<String> descriptionTemplates = new ArrayList<>();
}
