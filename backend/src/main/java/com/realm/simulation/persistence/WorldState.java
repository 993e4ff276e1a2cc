package com.realm.simulation.persistence;

import com.realm.simulation.entity.LocationState;
import com.realm.simulation.entity.NpcState;
import com.realm.simulation.event.EventBusSummary;
import com.realm.simulation.time.TimeState;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 世界的完整可存档状态
 *
 * seed 与 randomDraws 记录随机流位置，读档后从同一位置继续。
 */
@Data
public class WorldState {

    private String name;

    private long seed;

    private long randomDraws;

    private double totalSimulationTime;

    private TimeState time;

    private EventBusSummary events;

    private Map<String, LocationState> locations = new LinkedHashMap<>();

    private Map<String, NpcState> npcs = new LinkedHashMap<>();
}
