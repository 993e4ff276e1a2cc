package com.realm.simulation.time;

/**
 * 季节，每季 90 天
 */
public enum Season {

    SPRING("spring", "Spring"),
    SUMMER("summer", "Summer"),
    AUTUMN("autumn", "Fall"),
    WINTER("winter", "Winter");

    private final String key;
    private final String displayName;

    Season(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    /**
     * 生物群系配置中使用的键
     */
    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static Season ofDay(int dayOfYear) {
        return values()[((dayOfYear - 1) / TimeManager.DAYS_PER_SEASON) % values().length];
    }
}
