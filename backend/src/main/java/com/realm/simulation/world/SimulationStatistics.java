package com.realm.simulation.world;

import lombok.Data;

/**
 * 模拟器运行统计
 */
@Data
public class SimulationStatistics {

    private long ticks;

    private long totalMinutesSimulated;

    private long eventsProcessed;

    private long npcsSpawned;

    private long entityFailures;

    private long autosaves;

    public SimulationStatistics copy() {
        SimulationStatistics copy = new SimulationStatistics();
        copy.ticks = ticks;
        copy.totalMinutesSimulated = totalMinutesSimulated;
        copy.eventsProcessed = eventsProcessed;
        copy.npcsSpawned = npcsSpawned;
        copy.entityFailures = entityFailures;
        copy.autosaves = autosaves;
        return copy;
    }
}
