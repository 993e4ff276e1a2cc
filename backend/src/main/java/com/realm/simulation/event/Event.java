package com.realm.simulation.event;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 模拟事件
 *
 * id 在发布时由事件总线分配，timestamp 在处理（分发）时写入模拟总分钟数。
 */
@Getter
@ToString
public class Event {

    private String id;

    private final String type;

    private final Map<String, Object> data;

    private final String sourceId;

    private final String targetId;

    private final String locationId;

    private Long timestamp;

    @Builder
    public Event(String type, Map<String, Object> data, String sourceId, String targetId, String locationId) {
        if (type == null || type.isEmpty()) {
            throw new IllegalArgumentException("事件类型不能为空");
        }
        this.type = type;
        this.data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Collections.emptyMap();
        this.sourceId = sourceId;
        this.targetId = targetId;
        this.locationId = locationId;
    }

    public static Event of(String type) {
        return builder().type(type).build();
    }

    void assignId(String id) {
        if (this.id == null) {
            this.id = id;
        }
    }

    void stamp(long timestamp) {
        this.timestamp = timestamp;
    }
}
