package com.realm.simulation.event;

import lombok.Value;

/**
 * 单个处理器分发失败的记录
 */
@Value
public class HandlerFailure {

    String eventId;

    String eventType;

    /**
     * 是否为全局监听器
     */
    boolean global;

    Throwable error;
}
