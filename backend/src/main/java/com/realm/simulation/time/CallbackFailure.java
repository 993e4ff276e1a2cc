package com.realm.simulation.time;

import lombok.Value;

/**
 * 定时回调执行失败的记录
 */
@Value
public class CallbackFailure {

    long tick;

    Throwable error;
}
