package com.realm.simulation.world;

import com.realm.TestFixtures;
import com.realm.generator.ContentGenerator;
import com.realm.simulation.persistence.SaveInfo;
import com.realm.simulation.persistence.StateManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorldSimulatorTest {

    private WorldSimulator simulator;

    @BeforeEach
    void setUp() {
        SimulationSettings settings = SimulationSettings.builder().locationCount(2).build();
        World world = World.createNew(new ContentGenerator(TestFixtures.templates(), 31L), settings);
        simulator = new WorldSimulator(world);
    }

    @Test
    @DisplayName("按小时模拟返回步数并累计统计")
    void simulateHoursCountsSteps() {
        int steps = simulator.simulateHours(3, 30);

        assertThat(steps).isEqualTo(6);
        SimulationStatistics stats = simulator.getStatistics();
        assertThat(stats.getTicks()).isEqualTo(6);
        assertThat(stats.getTotalMinutesSimulated()).isEqualTo(180);
        assertThat(stats.getEventsProcessed()).isPositive();
        assertThat(simulator.getWorld().getTime().getHour()).isEqualTo(11);
    }

    @Test
    @DisplayName("simulateDay 推进到日期变化为止")
    void simulateDayStopsAtDayChange() {
        int steps = simulator.simulateDay(60);
        assertThat(steps).isEqualTo(16);
        assertThat(simulator.getWorld().getTime().getDay()).isEqualTo(2);
        assertThat(simulator.getWorld().getTime().getHour()).isZero();
    }

    @Test
    @DisplayName("每个tick调用回调，回调失败不影响模拟")
    void callbacksInvokedAndIsolated() {
        AtomicInteger calls = new AtomicInteger();
        Consumer<World> failing = w -> {
            throw new IllegalStateException("callback failure");
        };
        simulator.addCallback(failing);
        simulator.addCallback(w -> calls.incrementAndGet());

        simulator.simulateHours(2, 60);
        assertThat(calls.get()).isEqualTo(2);

        assertThat(simulator.removeCallback(failing)).isTrue();
    }

    @Test
    @DisplayName("runUntil 在条件满足时停止")
    void runUntilCondition() {
        boolean reached = simulator.runUntil(w -> w.getTime().getHour() >= 12, 100, 60);
        assertThat(reached).isTrue();
        assertThat(simulator.getWorld().getTime().getHour()).isEqualTo(12);

        boolean never = simulator.runUntil(w -> false, 3, 10);
        assertThat(never).isFalse();
        assertThat(simulator.getStatistics().getTicks()).isEqualTo(7);
    }

    @Test
    @DisplayName("生成的NPC计入统计")
    void spawnCountsInStatistics() {
        String locationId = simulator.getWorld().getLocations().iterator().next().getId();
        simulator.spawnNpc(locationId, null, null);
        simulator.spawnNpc(locationId, null, null);
        assertThat(simulator.getStatistics().getNpcsSpawned()).isEqualTo(2);
    }

    @Test
    @DisplayName("自动存档按间隔写入，只保留最新的若干个")
    void autosaveKeepsNewest(@TempDir Path dir) throws Exception {
        StateManager stateManager = new StateManager(dir);
        simulator.enableAutosave(stateManager, 60, 2);

        simulator.simulateHours(4, 30);

        List<SaveInfo> saves = stateManager.listSaves();
        assertThat(saves).hasSize(2);
        assertThat(saves).extracting(SaveInfo::getName)
            .containsExactlyInAnyOrder("autosave_0000000180", "autosave_0000000240");
        assertThat(simulator.getStatistics().getAutosaves()).isEqualTo(4);

        simulator.disableAutosave();
        simulator.simulateHours(2, 60);
        assertThat(stateManager.listSaves()).hasSize(2);
    }

    @Test
    @DisplayName("非法的步长与自动存档参数被拒绝")
    void invalidStepSizesRejected() {
        assertThatThrownBy(() -> simulator.simulateHours(1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> simulator.enableAutosave(null, 0, 1)).isInstanceOf(IllegalArgumentException.class);
    }
}
