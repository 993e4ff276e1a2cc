package com.realm.service;

import com.realm.config.RealmConfiguration;
import com.realm.dto.LocationView;
import com.realm.dto.NpcView;
import com.realm.dto.StepResult;
import com.realm.generator.ContentGenerator;
import com.realm.generator.RandomSource;
import com.realm.generator.template.TemplateStore;
import com.realm.simulation.entity.LivingNpc;
import com.realm.simulation.event.EventRecord;
import com.realm.simulation.persistence.SaveInfo;
import com.realm.simulation.persistence.SnapshotFormat;
import com.realm.simulation.persistence.StateManager;
import com.realm.simulation.world.SimulationSettings;
import com.realm.simulation.world.SimulationStatistics;
import com.realm.simulation.world.TickReport;
import com.realm.simulation.world.World;
import com.realm.simulation.world.WorldSimulator;
import com.realm.simulation.world.WorldSummary;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 世界模拟服务
 *
 * 持有当前运行的世界（至多一个），所有操作串行执行。
 */
@Service
@Slf4j
public class SimulationService {

    private final TemplateStore templates;
    private final StateManager stateManager;
    private final SimulationSettings defaults;
    private final RealmConfiguration configuration;

    private WorldSimulator simulator;

    public SimulationService(TemplateStore templates, StateManager stateManager,
                             SimulationSettings defaults, RealmConfiguration configuration) {
        this.templates = templates;
        this.stateManager = stateManager;
        this.defaults = defaults;
        this.configuration = configuration;
    }

    /**
     * 创建新世界并替换当前世界
     */
    public synchronized WorldSummary createWorld(String name, Integer locations, Long seed) {
        SimulationSettings settings = SimulationSettings.builder()
            .worldName(StringUtils.defaultIfBlank(name, defaults.getWorldName()))
            .locationCount(locations != null ? locations : defaults.getLocationCount())
            .maxHistory(defaults.getMaxHistory())
            .callbackPolicy(defaults.getCallbackPolicy())
            .build();
        Long effectiveSeed = seed != null ? seed : configuration.getSeed();
        ContentGenerator generator = new ContentGenerator(templates, RandomSource.fromSeed(effectiveSeed));
        simulator = new WorldSimulator(World.createNew(generator, settings));
        log.info("🌍 新世界已创建: {}", simulator.getWorld());
        return simulator.getWorld().summary();
    }

    public synchronized WorldSummary getSummary() {
        return requireWorld().summary();
    }

    /**
     * 分 steps 步推进共 minutes 分钟，余数分摊到前 minutes % steps 步，每步多 1 分钟
     */
    public synchronized StepResult step(int minutes, int steps) {
        if (steps <= 0 || minutes < steps) {
            throw new IllegalArgumentException("推进分钟数不能少于步数: minutes=" + minutes + ", steps=" + steps);
        }
        WorldSimulator current = requireSimulator();
        int perStep = minutes / steps;
        int remainder = minutes % steps;
        List<TickReport> reports = new ArrayList<>(steps);
        List<String> failures = new ArrayList<>();
        for (int i = 0; i < steps; i++) {
            TickReport report = current.step(i < remainder ? perStep + 1 : perStep);
            reports.add(report);
            collectFailures(report, failures);
        }
        if (!failures.isEmpty()) {
            log.warn("推进过程中出现 {} 个失败", failures.size());
        }
        return StepResult.of(reports, current.getWorld().summary(), failures);
    }

    private static void collectFailures(TickReport report, List<String> out) {
        report.getEntityFailures().forEach(f ->
            out.add(f.getKind() + " " + f.getEntityId() + ": " + f.getError().getMessage()));
        report.getCallbackFailures().forEach(f ->
            out.add("callback@" + f.getTick() + ": " + f.getError().getMessage()));
        report.getDispatch().getFailures().forEach(f ->
            out.add((f.isGlobal() ? "listener " : "handler ") + f.getEventType() + "/" + f.getEventId()
                + ": " + f.getError().getMessage()));
    }

    public synchronized SimulationStatistics getStatistics() {
        return requireSimulator().getStatistics();
    }

    public synchronized List<LocationView> listLocations() {
        return requireWorld().getLocations().stream().map(LocationView::of).collect(Collectors.toList());
    }

    public synchronized LocationView getLocation(String id) {
        return LocationView.of(requireWorld().requireLocation(id));
    }

    public synchronized List<NpcView> listNpcs(String locationId) {
        World world = requireWorld();
        List<LivingNpc> npcs = locationId != null
            ? world.getNpcsAtLocation(locationId)
            : new ArrayList<>(world.getNpcs());
        return npcs.stream().map(NpcView::of).collect(Collectors.toList());
    }

    public synchronized NpcView getNpc(String id) {
        return NpcView.of(requireWorld().requireNpc(id));
    }

    public synchronized NpcView spawnNpc(String locationId, List<String> professions, String race) {
        return NpcView.of(requireSimulator().spawnNpc(locationId, professions, race));
    }

    public synchronized void removeNpc(String id) {
        requireWorld().removeNpc(id);
    }

    public synchronized NpcView moveNpc(String id, String locationId) {
        World world = requireWorld();
        world.requireLocation(locationId);
        LivingNpc npc = world.requireNpc(id);
        npc.moveTo(locationId, world);
        return NpcView.of(npc);
    }

    public synchronized List<EventRecord> recentEvents(String type, int limit) {
        World world = requireWorld();
        return (type != null ? world.getEvents().getEventsByType(type, limit) : world.getEvents().getRecentEvents(limit))
            .stream()
            .map(EventRecord::of)
            .collect(Collectors.toList());
    }

    public synchronized String save(String name, String format, boolean compressed) throws IOException {
        Path path = requireWorld().save(stateManager, name, SnapshotFormat.parse(format), compressed);
        return path.toString();
    }

    public synchronized WorldSummary load(String name, String format) throws IOException {
        SnapshotFormat parsed = StringUtils.isBlank(format) ? null : SnapshotFormat.parse(format);
        World world = World.load(stateManager, name, parsed, templates, defaults);
        simulator = new WorldSimulator(world);
        log.info("📂 世界已从存档恢复: {}", world);
        return world.summary();
    }

    public List<SaveInfo> listSaves() throws IOException {
        return stateManager.listSaves();
    }

    public boolean deleteSave(String name) throws IOException {
        return stateManager.deleteSave(name);
    }

    private WorldSimulator requireSimulator() {
        if (simulator == null) {
            throw new IllegalStateException("尚未创建或加载世界");
        }
        return simulator;
    }

    private World requireWorld() {
        return requireSimulator().getWorld();
    }
}
