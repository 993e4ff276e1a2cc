package com.realm.common;

/**
 * 约束生成失败：在重试上限内未能生成满足调用方约束的物品
 */
public class GenerationExhaustedException extends RealmException {

    private final int attempts;
    private final Object constraints;

    public GenerationExhaustedException(int attempts, Object constraints) {
        super("尝试 " + attempts + " 次后仍无法满足约束: " + constraints, "GENERATION_EXHAUSTED");
        this.attempts = attempts;
        this.constraints = constraints;
    }

    public int getAttempts() {
        return attempts;
    }

    public Object getConstraints() {
        return constraints;
    }
}
