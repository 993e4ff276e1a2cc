package com.realm.generator.template;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 闭区间 [min, max]
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IntRange {

    private int min;

    private int max;

    public boolean contains(int value) {
        return value >= min && value <= max;
    }
}
