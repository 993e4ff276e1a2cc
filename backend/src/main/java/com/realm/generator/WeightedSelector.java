package com.realm.generator;

import com.realm.generator.template.NamedWeight;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * 加权选择：选中概率 = weight / Σweights
 *
 * 候选按声明顺序累加，保证同一随机流下结果确定。
 * 权重全为 0 时退化为均匀选择。
 */
public final class WeightedSelector {

    private WeightedSelector() {
    }

    public static <T> T select(RandomSource random, List<T> options, ToDoubleFunction<T> weightOf) {
        if (options == null || options.isEmpty()) {
            throw new IllegalArgumentException("没有可供选择的候选项");
        }

        double total = 0;
        for (T option : options) {
            double weight = weightOf.applyAsDouble(option);
            if (weight < 0 || Double.isNaN(weight)) {
                throw new IllegalArgumentException("权重不能为负: " + option + " -> " + weight);
            }
            total += weight;
        }

        if (total <= 0) {
            return random.choice(options);
        }

        double roll = random.nextDouble() * total;
        double cumulative = 0;
        for (T option : options) {
            double weight = weightOf.applyAsDouble(option);
            if (weight == 0) {
                continue;
            }
            cumulative += weight;
            if (roll < cumulative) {
                return option;
            }
        }

        // 浮点累加误差兜底：返回最后一个非零权重项
        for (int i = options.size() - 1; i >= 0; i--) {
            if (weightOf.applyAsDouble(options.get(i)) > 0) {
                return options.get(i);
            }
        }
        return options.get(options.size() - 1);
    }

    /**
     * 从 名称→带权重条目 的有序Map中选出一个名称
     */
    public static <W extends Weighted> String selectKey(RandomSource random, Map<String, W> entries) {
        List<String> keys = new ArrayList<>(entries.keySet());
        return select(random, keys, key -> entries.get(key).effectiveWeight());
    }

    /**
     * 从 {名称, 权重} 列表中选出一个名称
     */
    public static String selectName(RandomSource random, List<NamedWeight> entries) {
        return select(random, entries, NamedWeight::effectiveWeight).getName();
    }
}
