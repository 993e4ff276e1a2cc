package com.realm.simulation.entity;

import com.realm.generator.RandomSource;
import com.realm.generator.model.GeneratedLocation;
import com.realm.generator.model.GeneratedNpc;
import com.realm.generator.model.GeneratedWorld;
import com.realm.generator.model.Item;
import com.realm.simulation.event.EventBus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 把生成的静态内容包装成活的实体
 *
 * 实体ID与初始金币都从随机源抽取，保证同一种子可复现。
 */
public class EntityFactory {

    public static final int MIN_GOLD = 10;
    public static final int MAX_GOLD = 500;

    private final RandomSource random;

    public EntityFactory(RandomSource random) {
        this.random = random;
    }

    public LivingNpc createNpc(GeneratedNpc npc, String locationId) {
        return new LivingNpc(random.nextUuid(), npc, locationId, random.randInt(MIN_GOLD, MAX_GOLD));
    }

    /**
     * 地点沿用生成时的ID，地点内的物品各分配一个ID
     */
    public LivingLocation createLocation(GeneratedLocation location) {
        LivingLocation living = new LivingLocation(location.getId(), location);
        if (location.getItems() != null) {
            for (Item item : location.getItems()) {
                living.addItem(random.nextUuid(), item);
            }
        }
        return living;
    }

    /**
     * 按实体类型从存档状态还原
     */
    public Entity<?> restore(EntityKind kind, EntityState state) {
        switch (kind) {
            case LOCATION: {
                LocationState locationState = (LocationState) state;
                LivingLocation location = new LivingLocation(locationState.getId(), locationState.getLocation());
                location.deserialize(locationState);
                return location;
            }
            case NPC: {
                NpcState npcState = (NpcState) state;
                LivingNpc npc = new LivingNpc(npcState.getId(), npcState.getNpc(),
                    npcState.getCurrentLocationId(), npcState.getGold());
                npc.deserialize(npcState);
                return npc;
            }
            default:
                throw new IllegalArgumentException("未知的实体类型: " + kind);
        }
    }

    /**
     * 整个生成世界转换为实体：地点及其内嵌NPC，NPC登记到所在地点
     */
    public Population createWorld(GeneratedWorld world, EventBus events) {
        Map<String, LivingLocation> locations = new LinkedHashMap<>();
        List<LivingNpc> npcs = new ArrayList<>();
        for (Map.Entry<String, GeneratedLocation> entry : world.getLocations().entrySet()) {
            LivingLocation location = createLocation(entry.getValue());
            locations.put(entry.getKey(), location);
            for (GeneratedNpc generated : entry.getValue().getNpcs()) {
                LivingNpc npc = createNpc(generated, entry.getKey());
                npcs.add(npc);
                location.addNpc(npc.getId(), events);
            }
        }
        return new Population(locations, npcs);
    }

    /**
     * 转换结果
     */
    public static final class Population {

        private final Map<String, LivingLocation> locations;
        private final List<LivingNpc> npcs;

        Population(Map<String, LivingLocation> locations, List<LivingNpc> npcs) {
            this.locations = locations;
            this.npcs = npcs;
        }

        public Map<String, LivingLocation> getLocations() {
            return locations;
        }

        public List<LivingNpc> getNpcs() {
            return npcs;
        }
    }
}
