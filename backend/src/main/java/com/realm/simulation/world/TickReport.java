package com.realm.simulation.world;

import com.realm.simulation.entity.EntityFailure;
import com.realm.simulation.event.DispatchReport;
import com.realm.simulation.time.CallbackFailure;

import java.util.Collections;
import java.util.List;

/**
 * 一次tick的结果：实体更新失败、定时回调失败、事件分发结果
 */
public class TickReport {

    private final int minutes;
    private final List<EntityFailure> entityFailures;
    private final List<CallbackFailure> callbackFailures;
    private final DispatchReport dispatch;

    public TickReport(int minutes, List<EntityFailure> entityFailures,
                      List<CallbackFailure> callbackFailures, DispatchReport dispatch) {
        this.minutes = minutes;
        this.entityFailures = Collections.unmodifiableList(entityFailures);
        this.callbackFailures = Collections.unmodifiableList(callbackFailures);
        this.dispatch = dispatch;
    }

    public int getMinutes() {
        return minutes;
    }

    public List<EntityFailure> getEntityFailures() {
        return entityFailures;
    }

    public List<CallbackFailure> getCallbackFailures() {
        return callbackFailures;
    }

    public DispatchReport getDispatch() {
        return dispatch;
    }

    public int getEventsProcessed() {
        return dispatch.getDispatched();
    }

    public boolean hasFailures() {
        return !entityFailures.isEmpty() || !callbackFailures.isEmpty() || dispatch.hasFailures();
    }

    @Override
    public String toString() {
        return "TickReport{minutes=" + minutes + ", events=" + dispatch.getDispatched()
            + ", entityFailures=" + entityFailures.size()
            + ", callbackFailures=" + callbackFailures.size()
            + ", handlerFailures=" + dispatch.getFailures().size() + "}";
    }
}
