package com.realm.generator;

/**
 * 带权重的候选项，未配置权重时按 1.0 处理
 */
public interface Weighted {

    double DEFAULT_WEIGHT = 1.0;

    Double getWeight();

    default double effectiveWeight() {
        Double weight = getWeight();
        return weight != null ? weight : DEFAULT_WEIGHT;
    }
}
