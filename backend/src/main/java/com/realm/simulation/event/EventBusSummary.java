package com.realm.simulation.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventBusSummary {

    private int queueSize;

    private int historySize;

    private int maxHistory;

    /**
     * 最近的事件，新的在前
     */
    @Builder.Default
    private List<EventRecord> recentEvents = new ArrayList<>();
}
