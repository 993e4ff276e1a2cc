package com.realm.simulation.world;

import com.realm.simulation.event.EventBus;
import com.realm.simulation.time.CallbackPolicy;
import lombok.Builder;
import lombok.Value;

/**
 * 模拟参数，由配置层传入，核心不直接读取 Spring 配置
 */
@Value
@Builder
public class SimulationSettings {

    public static final SimulationSettings DEFAULTS = SimulationSettings.builder().build();

    @Builder.Default
    String worldName = "New World";

    @Builder.Default
    int locationCount = 5;

    @Builder.Default
    int maxHistory = EventBus.DEFAULT_MAX_HISTORY;

    @Builder.Default
    CallbackPolicy callbackPolicy = CallbackPolicy.EXACT_TICK;
}
