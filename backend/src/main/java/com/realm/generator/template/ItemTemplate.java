package com.realm.generator.template;

import com.realm.generator.Weighted;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ItemTemplate implements Weighted {

    private String type;

    private String subtype;

    private Double weight;

    private List<String> baseNames = new ArrayList<>();

    private boolean hasQuality;

    private boolean hasRarity;

    private boolean hasMaterial;

    private IntRange statCount = new IntRange(0, 0);

    private IntRange valueRange = new IntRange(1, 1);

    /**
     * 为空表示该模板不带伤害类型
     */
    private IntRange damageTypeCount;

    private List<String> descriptionTemplates = new ArrayList<>();

    private boolean consumable;

    private boolean singleUse;

    private boolean providesDefense;
}
