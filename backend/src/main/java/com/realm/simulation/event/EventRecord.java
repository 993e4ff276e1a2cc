package com.realm.simulation.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 事件在存档摘要中的形式
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventRecord {

    private String id;

    private String type;

    private String source;

    private String target;

    private String location;

    private Long timestamp;

    private Map<String, Object> data;

    public static EventRecord of(Event event) {
        return EventRecord.builder()
            .id(event.getId())
            .type(event.getType())
            .source(event.getSourceId())
            .target(event.getTargetId())
            .location(event.getLocationId())
            .timestamp(event.getTimestamp())
            .data(event.getData())
            .build();
    }
}
