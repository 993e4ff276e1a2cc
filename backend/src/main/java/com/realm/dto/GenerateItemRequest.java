package com.realm.dto;

import com.realm.generator.model.ItemConstraints;
import lombok.Data;

import javax.validation.constraints.PositiveOrZero;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * 物品生成请求
 */
@Data
public class GenerateItemRequest {

    /**
     * 物品模板，为空时随机
     */
    private String template;

    private String minQuality;

    private String maxQuality;

    private String minRarity;

    private String maxRarity;

    @PositiveOrZero
    private Integer minValue;

    @PositiveOrZero
    private Integer maxValue;

    private List<String> excludedMaterials = new ArrayList<>();

    private List<String> requiredStats = new ArrayList<>();

    public ItemConstraints toConstraints() {
        return ItemConstraints.builder()
            .minQuality(minQuality)
            .maxQuality(maxQuality)
            .minRarity(minRarity)
            .maxRarity(maxRarity)
            .minValue(minValue)
            .maxValue(maxValue)
            .excludedMaterials(excludedMaterials != null ? new LinkedHashSet<>(excludedMaterials) : new LinkedHashSet<>())
            .requiredStats(requiredStats != null ? requiredStats : new ArrayList<>())
            .build();
    }
}
