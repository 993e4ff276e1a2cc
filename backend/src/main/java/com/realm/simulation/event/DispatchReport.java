package com.realm.simulation.event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次发布或队列处理的分发结果
 *
 * 处理器失败被隔离并收集在这里，而不是静默吞掉。
 */
public class DispatchReport {

    private int dispatched;
    private final List<HandlerFailure> failures = new ArrayList<>();

    public static DispatchReport empty() {
        return new DispatchReport();
    }

    void recordDispatched() {
        dispatched++;
    }

    void recordFailure(HandlerFailure failure) {
        failures.add(failure);
    }

    public void merge(DispatchReport other) {
        dispatched += other.dispatched;
        failures.addAll(other.failures);
    }

    /**
     * 已分发的事件数
     */
    public int getDispatched() {
        return dispatched;
    }

    public List<HandlerFailure> getFailures() {
        return Collections.unmodifiableList(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    @Override
    public String toString() {
        return "DispatchReport{dispatched=" + dispatched + ", failures=" + failures.size() + "}";
    }
}
