package com.realm.simulation.world;

import com.realm.common.EntityNotFoundException;
import com.realm.generator.ContentGenerator;
import com.realm.generator.RandomSource;
import com.realm.generator.model.GeneratedNpc;
import com.realm.generator.model.GeneratedWorld;
import com.realm.generator.template.TemplateStore;
import com.realm.simulation.entity.Entity;
import com.realm.simulation.entity.EntityFactory;
import com.realm.simulation.entity.EntityFailure;
import com.realm.simulation.entity.EntityKind;
import com.realm.simulation.entity.LivingLocation;
import com.realm.simulation.entity.LivingNpc;
import com.realm.simulation.entity.LocationState;
import com.realm.simulation.entity.NpcState;
import com.realm.simulation.event.DispatchReport;
import com.realm.simulation.event.Event;
import com.realm.simulation.event.EventBus;
import com.realm.simulation.event.EventTypes;
import com.realm.simulation.persistence.SnapshotFormat;
import com.realm.simulation.persistence.StateManager;
import com.realm.simulation.persistence.WorldState;
import com.realm.simulation.time.CallbackFailure;
import com.realm.simulation.time.TimeManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 模拟世界
 *
 * 持有时间、事件总线和全部实体。一个tick的顺序固定：
 * 推进时间 → 更新地点 → 更新NPC → 处理事件队列 → 检测整点/换日。
 * 单个实体更新失败会被隔离并记录在 {@link TickReport} 中，不影响其它实体。
 */
public class World {

    private static final Logger logger = LoggerFactory.getLogger(World.class);

    private final String name;
    private final ContentGenerator generator;
    private final TimeManager time;
    private final EventBus events;
    private final EntityFactory factory;
    private final Map<String, LivingLocation> locations = new LinkedHashMap<>();
    private final Map<String, LivingNpc> npcs = new LinkedHashMap<>();
    private final Set<String> pendingRemovals = new LinkedHashSet<>();

    private double totalSimulationTime;
    private int lastHour;
    private int lastDay;
    private boolean ticking;

    public World(String name, ContentGenerator generator, SimulationSettings settings) {
        this(name, generator, new TimeManager(), settings);
    }

    public World(String name, ContentGenerator generator, TimeManager time, SimulationSettings settings) {
        this.name = name;
        this.generator = generator;
        this.time = time;
        this.time.setCallbackPolicy(settings.getCallbackPolicy());
        this.events = new EventBus(settings.getMaxHistory(), time::getTotalMinutes);
        this.factory = new EntityFactory(generator.getRandom());
        this.lastHour = time.getHour();
        this.lastDay = time.getDay();
    }

    /**
     * 生成一个新世界：生成地点图，转换为实体，发布世界创建事件
     */
    public static World createNew(ContentGenerator generator, SimulationSettings settings) {
        World world = new World(settings.getWorldName(), generator, settings);
        GeneratedWorld generated = generator.generateWorld(settings.getLocationCount());

        EntityFactory.Population population = world.factory.createWorld(generated, world.events);
        world.locations.putAll(population.getLocations());
        for (LivingNpc npc : population.getNpcs()) {
            world.npcs.put(npc.getId(), npc);
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("world_name", world.name);
        data.put("num_locations", world.locations.size());
        data.put("num_npcs", world.npcs.size());
        world.events.publish(Event.builder().type(EventTypes.LOCATION_CREATED).data(data).build());

        logger.info("世界创建完成: name={}, 地点={}, NPC={}, seed={}",
            world.name, world.locations.size(), world.npcs.size(), generator.getRandom().getSeed());
        return world;
    }

    // ---------------------------------------------------------------- tick

    /**
     * 推进一个tick，时间按整数分钟推进（小数部分截断），实体收到原始 delta
     */
    public TickReport update(double delta) {
        if (delta < 0) {
            throw new IllegalArgumentException("delta 不能为负: " + delta);
        }
        int minutes = (int) delta;
        List<EntityFailure> failures = new ArrayList<>();
        List<CallbackFailure> callbackFailures;
        DispatchReport dispatch = new DispatchReport();

        ticking = true;
        try {
            callbackFailures = time.advanceMinutes(minutes);
            totalSimulationTime += delta;

            for (LivingLocation location : new ArrayList<>(locations.values())) {
                updateEntity(location, delta, failures);
            }
            for (LivingNpc npc : new ArrayList<>(npcs.values())) {
                updateEntity(npc, delta, failures);
            }

            dispatch.merge(events.processEvents());
            dispatch.merge(checkTimeBoundaries());
        } finally {
            ticking = false;
            flushRemovals();
        }

        TickReport report = new TickReport(minutes, failures, callbackFailures, dispatch);
        if (report.hasFailures()) {
            logger.warn("tick完成但存在失败: {}", report);
        } else {
            logger.debug("tick完成: {}", report);
        }
        return report;
    }

    public TickReport step(int minutes) {
        return update(minutes);
    }

    public TickReport simulateHours(int hours) {
        return update(hours * (double) TimeManager.MINUTES_PER_HOUR);
    }

    public TickReport simulateDays(int days) {
        return update(days * (double) TimeManager.MINUTES_PER_DAY);
    }

    private void updateEntity(Entity<?> entity, double delta, List<EntityFailure> failures) {
        try {
            entity.update(delta, this);
        } catch (RuntimeException e) {
            logger.error("实体更新失败: kind={}, id={}", entity.getKind(), entity.getId(), e);
            failures.add(new EntityFailure(entity.getId(), entity.getKind(), e));
        }
    }

    /**
     * 与上一个tick缓存的小时/日期比较，变化时立即发布边界事件
     */
    private DispatchReport checkTimeBoundaries() {
        DispatchReport report = new DispatchReport();
        if (time.getHour() != lastHour) {
            report.merge(events.publish(Event.builder()
                .type(EventTypes.HOUR_PASSED)
                .data(Collections.singletonMap("hour", time.getHour()))
                .build(), true));
        }
        if (time.getDay() != lastDay) {
            report.merge(events.publish(Event.builder()
                .type(EventTypes.DAY_PASSED)
                .data(Collections.singletonMap("day", time.getDay()))
                .build(), true));
        }
        lastHour = time.getHour();
        lastDay = time.getDay();
        return report;
    }

    private void flushRemovals() {
        for (String id : pendingRemovals) {
            npcs.remove(id);
        }
        pendingRemovals.clear();
    }

    // ---------------------------------------------------------------- NPC lifecycle

    /**
     * 在指定地点生成新的NPC
     *
     * @param professions null 表示随机职业，空列表表示平民
     */
    public LivingNpc spawnNpc(String locationId, List<String> professions, String race) {
        LivingLocation location = requireLocation(locationId);
        GeneratedNpc generated = generator.generateNpc(professions, race, null);
        LivingNpc npc = factory.createNpc(generated, locationId);

        npcs.put(npc.getId(), npc);
        location.addNpc(npc.getId(), events);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("npc_name", npc.getName());
        data.put("profession", npc.getProfession());
        events.publish(Event.builder()
            .type(EventTypes.NPC_SPAWNED)
            .sourceId(npc.getId())
            .locationId(locationId)
            .data(data)
            .build());
        logger.info("NPC生成: id={}, name={}, location={}", npc.getId(), npc.getName(), locationId);
        return npc;
    }

    /**
     * 移除NPC：立即标记失效；tick进行中时在tick结束后才从世界中删除
     */
    public void removeNpc(String npcId) {
        LivingNpc npc = npcs.get(npcId);
        if (npc == null || !npc.isActive()) {
            throw new EntityNotFoundException("NPC", npcId);
        }
        npc.destroy();

        LivingLocation location = npc.getCurrentLocationId() != null
            ? locations.get(npc.getCurrentLocationId()) : null;
        if (location != null) {
            location.removeNpc(npcId, events);
        }

        events.publish(Event.builder()
            .type(EventTypes.NPC_DIED)
            .sourceId(npcId)
            .data(Collections.singletonMap("npc_name", npc.getName()))
            .build());

        if (ticking) {
            pendingRemovals.add(npcId);
        } else {
            npcs.remove(npcId);
        }
        logger.info("NPC移除: id={}, name={}", npcId, npc.getName());
    }

    // ---------------------------------------------------------------- lookups

    public LivingLocation getLocation(String id) {
        return locations.get(id);
    }

    public LivingLocation requireLocation(String id) {
        LivingLocation location = locations.get(id);
        if (location == null) {
            throw new EntityNotFoundException("地点", id);
        }
        return location;
    }

    public LivingNpc getNpc(String id) {
        return npcs.get(id);
    }

    public LivingNpc requireNpc(String id) {
        LivingNpc npc = npcs.get(id);
        if (npc == null) {
            throw new EntityNotFoundException("NPC", id);
        }
        return npc;
    }

    public List<LivingNpc> getNpcsAtLocation(String locationId) {
        List<LivingNpc> result = new ArrayList<>();
        for (LivingNpc npc : npcs.values()) {
            if (locationId.equals(npc.getCurrentLocationId())) {
                result.add(npc);
            }
        }
        return result;
    }

    public List<LivingNpc> getActiveNpcs() {
        List<LivingNpc> result = new ArrayList<>();
        for (LivingNpc npc : npcs.values()) {
            if (npc.isActive()) {
                result.add(npc);
            }
        }
        return result;
    }

    public Collection<LivingLocation> getLocations() {
        return Collections.unmodifiableCollection(locations.values());
    }

    public Collection<LivingNpc> getNpcs() {
        return Collections.unmodifiableCollection(npcs.values());
    }

    public void addLocation(LivingLocation location) {
        locations.put(location.getId(), location);
    }

    public WorldSummary summary() {
        return WorldSummary.builder()
            .name(name)
            .seed(generator.getRandom().getSeed())
            .time(time.getFullDateTimeString())
            .totalSimulationTime(totalSimulationTime)
            .locations(locations.size())
            .npcs(npcs.size())
            .activeNpcs(getActiveNpcs().size())
            .eventsInQueue(events.getQueueSize())
            .historySize(events.getHistorySize())
            .build();
    }

    public String getName() {
        return name;
    }

    public ContentGenerator getGenerator() {
        return generator;
    }

    public RandomSource getRandom() {
        return generator.getRandom();
    }

    public TimeManager getTime() {
        return time;
    }

    public EventBus getEvents() {
        return events;
    }

    public EntityFactory getFactory() {
        return factory;
    }

    public double getTotalSimulationTime() {
        return totalSimulationTime;
    }

    // ---------------------------------------------------------------- persistence

    public WorldState toState() {
        WorldState state = new WorldState();
        state.setName(name);
        state.setSeed(generator.getRandom().getSeed());
        state.setRandomDraws(generator.getRandom().getDraws());
        state.setTotalSimulationTime(totalSimulationTime);
        state.setTime(time.toState());
        state.setEvents(events.summary());

        Map<String, LocationState> locationStates = new LinkedHashMap<>();
        locations.forEach((id, location) -> locationStates.put(id, location.serialize()));
        state.setLocations(locationStates);

        Map<String, NpcState> npcStates = new LinkedHashMap<>();
        npcs.forEach((id, npc) -> npcStates.put(id, npc.serialize()));
        state.setNpcs(npcStates);
        return state;
    }

    /**
     * 从存档状态重建世界，随机源按种子重建并快进到存档时的位置
     */
    public static World fromState(WorldState state, TemplateStore templates, SimulationSettings settings) {
        RandomSource random = RandomSource.restore(state.getSeed(), state.getRandomDraws());
        ContentGenerator generator = new ContentGenerator(templates, random);
        World world = new World(state.getName(), generator, TimeManager.fromState(state.getTime()), settings);
        world.totalSimulationTime = state.getTotalSimulationTime();

        if (state.getLocations() != null) {
            state.getLocations().forEach((id, locationState) ->
                world.locations.put(id, (LivingLocation) world.factory.restore(EntityKind.LOCATION, locationState)));
        }
        if (state.getNpcs() != null) {
            state.getNpcs().forEach((id, npcState) ->
                world.npcs.put(id, (LivingNpc) world.factory.restore(EntityKind.NPC, npcState)));
        }
        return world;
    }

    public Path save(StateManager stateManager, String saveName, SnapshotFormat format, boolean compressed)
        throws IOException {
        return stateManager.save(toState(), saveName, format, compressed);
    }

    public static World load(StateManager stateManager, String saveName, SnapshotFormat format,
                             TemplateStore templates, SimulationSettings settings) throws IOException {
        return fromState(stateManager.load(saveName, format), templates, settings);
    }

    @Override
    public String toString() {
        return "World{name='" + name + "', locations=" + locations.size() + ", npcs=" + npcs.size()
            + ", time=" + time.getTimeString() + "}";
    }
}
