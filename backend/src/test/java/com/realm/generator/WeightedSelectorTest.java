package com.realm.generator;

import com.realm.generator.template.NamedWeight;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WeightedSelectorTest {

    @Test
    @DisplayName("权重为零的候选项永远不会被选中")
    void zeroWeightNeverChosen() {
        RandomSource random = new RandomSource(11L);
        List<NamedWeight> entries = Arrays.asList(
            new NamedWeight("never", 0.0),
            new NamedWeight("always", 2.0));
        for (int i = 0; i < 200; i++) {
            assertThat(WeightedSelector.selectName(random, entries)).isEqualTo("always");
        }
    }

    @Test
    @DisplayName("权重全为零时退化为均匀选择")
    void allZeroFallsBackToUniform() {
        RandomSource random = new RandomSource(5L);
        List<NamedWeight> entries = Arrays.asList(new NamedWeight("a", 0.0), new NamedWeight("b", 0.0));
        Map<String, Integer> counts = new HashMap<>();
        for (int i = 0; i < 200; i++) {
            counts.merge(WeightedSelector.selectName(random, entries), 1, Integer::sum);
        }
        assertThat(counts).containsKeys("a", "b");
    }

    @Test
    @DisplayName("抽样频率大致符合权重比例")
    void frequenciesFollowWeights() {
        RandomSource random = new RandomSource(2024L);
        List<NamedWeight> entries = Arrays.asList(new NamedWeight("heavy", 9.0), new NamedWeight("light", 1.0));
        int heavy = 0;
        int trials = 10000;
        for (int i = 0; i < trials; i++) {
            if ("heavy".equals(WeightedSelector.selectName(random, entries))) {
                heavy++;
            }
        }
        assertThat(heavy / (double) trials).isBetween(0.85, 0.95);
    }

    @Test
    @DisplayName("未声明权重按1计算")
    void missingWeightCountsAsOne() {
        assertThat(new NamedWeight("x", null).effectiveWeight()).isEqualTo(Weighted.DEFAULT_WEIGHT);
    }

    @Test
    @DisplayName("负权重与空候选被拒绝")
    void rejectsNegativeWeightAndEmptyOptions() {
        RandomSource random = new RandomSource(1L);
        assertThatThrownBy(() -> WeightedSelector.selectName(random, Arrays.asList(new NamedWeight("bad", -1.0))))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> WeightedSelector.select(random, List.<String>of(), s -> 1.0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
