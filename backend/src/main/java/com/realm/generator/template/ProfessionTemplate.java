package com.realm.generator.template;

import com.realm.generator.Weighted;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

@Data
public class ProfessionTemplate implements Weighted {

    private String title;

    private Double weight;

    private LinkedHashMap<String, Integer> baseStats = new LinkedHashMap<>();

    private List<String> skills = new ArrayList<>();

    private List<String> dialogue = new ArrayList<>();

    private List<String> descriptionTemplates = new ArrayList<>();

    private List<String> allowedRaces = new ArrayList<>();

    private List<String> allowedFactions = new ArrayList<>();

    /**
     * 初始库存来源的物品集合，可为空
     */
    private String itemSet;

    /**
     * 是否在工作时间上班
     */
    private boolean works;

    /**
     * 上班时可能制作的物品模板，为空表示不制作
     */
    private List<String> craftTemplates = new ArrayList<>();
}
