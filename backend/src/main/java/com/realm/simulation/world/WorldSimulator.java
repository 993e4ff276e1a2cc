package com.realm.simulation.world;

import com.realm.simulation.entity.LivingNpc;
import com.realm.simulation.persistence.SaveInfo;
import com.realm.simulation.persistence.SnapshotFormat;
import com.realm.simulation.persistence.StateManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * 世界模拟器
 *
 * 在 {@link World} 之上提供按步运行、每tick回调、统计和自动存档。
 * 回调失败被隔离并记录，不会中断模拟。
 */
public class WorldSimulator {

    private static final Logger logger = LoggerFactory.getLogger(WorldSimulator.class);

    public static final int DEFAULT_MINUTES_PER_STEP = 60;
    public static final int DEFAULT_MAX_ITERATIONS = 10000;
    public static final String AUTOSAVE_PREFIX = "autosave_";

    private final World world;
    private final List<Consumer<World>> callbacks = new ArrayList<>();
    private final SimulationStatistics statistics = new SimulationStatistics();

    private StateManager stateManager;
    private int autosaveIntervalMinutes;
    private int autosaveKeep;
    private long minutesSinceAutosave;

    public WorldSimulator(World world) {
        this.world = world;
    }

    /**
     * 启用自动存档：每模拟 intervalMinutes 分钟存一次，只保留最新的 keep 个
     */
    public void enableAutosave(StateManager stateManager, int intervalMinutes, int keep) {
        if (intervalMinutes <= 0 || keep <= 0) {
            throw new IllegalArgumentException("自动存档参数必须为正: interval=" + intervalMinutes + ", keep=" + keep);
        }
        this.stateManager = stateManager;
        this.autosaveIntervalMinutes = intervalMinutes;
        this.autosaveKeep = keep;
        this.minutesSinceAutosave = 0;
        logger.info("自动存档已启用: 每{}分钟, 保留{}个", intervalMinutes, keep);
    }

    public void disableAutosave() {
        this.stateManager = null;
    }

    public void addCallback(Consumer<World> callback) {
        callbacks.add(callback);
    }

    public boolean removeCallback(Consumer<World> callback) {
        return callbacks.remove(callback);
    }

    /**
     * 推进一步
     */
    public TickReport step(int minutes) {
        TickReport report = world.step(minutes);
        statistics.setTicks(statistics.getTicks() + 1);
        statistics.setTotalMinutesSimulated(statistics.getTotalMinutesSimulated() + minutes);
        statistics.setEventsProcessed(statistics.getEventsProcessed() + report.getEventsProcessed());
        statistics.setEntityFailures(statistics.getEntityFailures() + report.getEntityFailures().size());

        for (Consumer<World> callback : new ArrayList<>(callbacks)) {
            try {
                callback.accept(world);
            } catch (RuntimeException e) {
                logger.error("模拟回调执行失败", e);
            }
        }

        if (stateManager != null) {
            minutesSinceAutosave += minutes;
            if (minutesSinceAutosave >= autosaveIntervalMinutes) {
                minutesSinceAutosave = 0;
                autosave();
            }
        }
        return report;
    }

    public int simulateHours(int hours, int minutesPerStep) {
        requirePositive(minutesPerStep);
        int steps = hours * 60 / minutesPerStep;
        for (int i = 0; i < steps; i++) {
            step(minutesPerStep);
        }
        logger.debug("模拟了{}小时, 共{}步, 当前时间 {}", hours, steps, world.getTime().getFullDateTimeString());
        return steps;
    }

    public int simulateDays(int days, int minutesPerStep) {
        logger.info("开始模拟{}天", days);
        return simulateHours(days * 24, minutesPerStep);
    }

    /**
     * 一直推进到日期变化
     */
    public int simulateDay(int minutesPerStep) {
        requirePositive(minutesPerStep);
        int startDay = world.getTime().getDay();
        int steps = 0;
        while (world.getTime().getDay() == startDay) {
            step(minutesPerStep);
            steps++;
        }
        logger.info("第{}天模拟完成, 当前 {}", startDay, world.getTime().getFullDateTimeString());
        return steps;
    }

    /**
     * 推进直到条件满足或达到迭代上限
     *
     * @return 条件是否满足
     */
    public boolean runUntil(Predicate<World> condition, int maxIterations, int minutesPerStep) {
        requirePositive(minutesPerStep);
        int iterations = 0;
        while (!condition.test(world) && iterations < maxIterations) {
            step(minutesPerStep);
            iterations++;
        }
        boolean reached = condition.test(world);
        if (!reached) {
            logger.warn("达到最大迭代次数 {} 仍未满足条件", maxIterations);
        }
        return reached;
    }

    public LivingNpc spawnNpc(String locationId, List<String> professions, String race) {
        LivingNpc npc = world.spawnNpc(locationId, professions, race);
        statistics.setNpcsSpawned(statistics.getNpcsSpawned() + 1);
        return npc;
    }

    private void autosave() {
        String name = String.format("%s%010d", AUTOSAVE_PREFIX, world.getTime().getTotalMinutes());
        try {
            world.save(stateManager, name, SnapshotFormat.JSON, true);
            statistics.setAutosaves(statistics.getAutosaves() + 1);
            pruneAutosaves();
        } catch (IOException e) {
            throw new UncheckedIOException("自动存档失败: " + name, e);
        }
    }

    /**
     * 按名称排序（名称含总分钟数），删除较旧的自动存档
     */
    private void pruneAutosaves() throws IOException {
        List<String> names = new ArrayList<>();
        for (SaveInfo save : stateManager.listSaves()) {
            if (save.getName().startsWith(AUTOSAVE_PREFIX) && !names.contains(save.getName())) {
                names.add(save.getName());
            }
        }
        names.sort(null);
        for (int i = 0; i < names.size() - autosaveKeep; i++) {
            stateManager.deleteSave(names.get(i));
        }
    }

    private static void requirePositive(int minutesPerStep) {
        if (minutesPerStep <= 0) {
            throw new IllegalArgumentException("每步分钟数必须为正: " + minutesPerStep);
        }
    }

    public SimulationStatistics getStatistics() {
        return statistics.copy();
    }

    public World getWorld() {
        return world;
    }
}
