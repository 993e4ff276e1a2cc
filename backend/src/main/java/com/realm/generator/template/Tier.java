package com.realm.generator.template;

import com.realm.generator.Weighted;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 品质/稀有度等级：价值倍率 + 抽取权重
 * 等级之间的大小关系只看声明顺序，与倍率无关
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Tier implements Weighted {

    private double multiplier = 1.0;

    private Double weight;
}
