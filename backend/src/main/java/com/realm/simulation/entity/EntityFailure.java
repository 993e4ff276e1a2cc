package com.realm.simulation.entity;

import lombok.Value;

/**
 * 单个实体在一次tick中更新失败的记录
 */
@Value
public class EntityFailure {

    String entityId;

    EntityKind kind;

    Throwable error;
}
