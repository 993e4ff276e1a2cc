package com.realm.simulation.time;

/**
 * 定时回调的触发策略
 */
public enum CallbackPolicy {

    /**
     * 只触发恰好等于当前总分钟数的回调，被一次大步推进跳过的回调永远不会触发
     */
    EXACT_TICK,

    /**
     * 触发所有到期（不晚于当前总分钟数）的回调，按到期时间先后执行
     */
    ON_OR_AFTER
}
