package com.realm.simulation.time;

/**
 * 一天中的时段，区间左闭右开
 */
public enum TimeOfDay {

    NIGHT("night", 0, 6),
    DAWN("dawn", 6, 8),
    MORNING("morning", 8, 12),
    AFTERNOON("afternoon", 12, 17),
    DUSK("dusk", 17, 19),
    EVENING("evening", 19, 24);

    private final String key;
    private final int startHour;
    private final int endHour;

    TimeOfDay(String key, int startHour, int endHour) {
        this.key = key;
        this.startHour = startHour;
        this.endHour = endHour;
    }

    public String getKey() {
        return key;
    }

    public static TimeOfDay ofHour(int hour) {
        for (TimeOfDay period : values()) {
            if (hour >= period.startHour && hour < period.endHour) {
                return period;
            }
        }
        return NIGHT;
    }
}
