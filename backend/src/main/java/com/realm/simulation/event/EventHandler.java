package com.realm.simulation.event;

/**
 * 事件处理器
 */
@FunctionalInterface
public interface EventHandler {

    void handle(Event event);
}
