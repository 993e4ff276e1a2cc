package com.realm.simulation.world;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class WorldSummary {

    String name;

    long seed;

    String time;

    double totalSimulationTime;

    int locations;

    int npcs;

    int activeNpcs;

    int eventsInQueue;

    int historySize;
}
