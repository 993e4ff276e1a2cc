package com.realm.simulation.entity;

import lombok.Data;

/**
 * 实体存档状态的公共字段
 */
@Data
public abstract class EntityState {

    private String id;

    private boolean active = true;

    /**
     * 累计经过的模拟分钟数
     */
    private double lastUpdate;
}
