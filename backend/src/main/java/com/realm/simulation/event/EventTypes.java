package com.realm.simulation.event;

/**
 * 标准事件类型
 */
public final class EventTypes {

    // 实体
    public static final String ENTITY_SPAWNED = "entity_spawned";
    public static final String ENTITY_DESTROYED = "entity_destroyed";

    // NPC
    public static final String NPC_SPAWNED = "npc_spawned";
    public static final String NPC_DIED = "npc_died";
    public static final String NPC_STARTED_WORKING = "npc_started_working";
    public static final String NPC_STARTED_TRAVELING = "npc_started_traveling";
    public static final String NPC_ARRIVED = "npc_arrived";
    public static final String NPC_ENTERED_LOCATION = "npc_entered_location";
    public static final String NPC_EXITED_LOCATION = "npc_exited_location";

    // 物品
    public static final String ITEM_CRAFTED = "item_crafted";

    // 地点
    public static final String LOCATION_CREATED = "location_created";

    // 经济
    public static final String MARKET_OPENED = "market_opened";
    public static final String MARKET_CLOSED = "market_closed";

    // 天气
    public static final String WEATHER_CHANGED = "weather_changed";

    // 时间
    public static final String HOUR_PASSED = "hour_passed";
    public static final String DAY_PASSED = "day_passed";

    private EventTypes() {
    }
}
