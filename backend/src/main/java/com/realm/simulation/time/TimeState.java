package com.realm.simulation.time;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 时间快照（存档用）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeState {

    private int year;

    private int day;

    private int hour;

    private int minute;

    private long totalMinutes;

    @Builder.Default
    private double timeScale = 1.0;
}
