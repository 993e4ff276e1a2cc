package com.realm.dto;

import com.realm.simulation.world.TickReport;
import com.realm.simulation.world.WorldSummary;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 推进结果：每步的事件数与失败数，以及推进后的世界概况
 */
@Value
@Builder
public class StepResult {

    int steps;

    int minutes;

    int eventsProcessed;

    int failures;

    List<String> failureMessages;

    WorldSummary world;

    public static StepResult of(List<TickReport> reports, WorldSummary summary, List<String> failureMessages) {
        int minutes = 0;
        int events = 0;
        for (TickReport report : reports) {
            minutes += report.getMinutes();
            events += report.getEventsProcessed();
        }
        return StepResult.builder()
            .steps(reports.size())
            .minutes(minutes)
            .eventsProcessed(events)
            .failures(failureMessages.size())
            .failureMessages(failureMessages)
            .world(summary)
            .build();
    }
}
