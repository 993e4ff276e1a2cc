package com.realm.simulation.entity;

import com.realm.simulation.world.World;

/**
 * 模拟实体的统一生命周期
 *
 * @param <S> 实体的存档状态类型
 */
public interface Entity<S extends EntityState> {

    String getId();

    EntityKind getKind();

    boolean isActive();

    /**
     * 标记为失效，实体不再参与更新
     */
    void destroy();

    /**
     * 每个tick调用一次
     *
     * @param delta 本tick经过的模拟分钟数
     */
    void update(double delta, World world);

    S serialize();

    void deserialize(S state);
}
