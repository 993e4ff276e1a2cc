package com.realm.simulation.entity;

import com.realm.generator.model.GeneratedNpc;
import com.realm.generator.model.Item;
import com.realm.generator.template.ProfessionTemplate;
import com.realm.generator.template.TemplateStore;
import com.realm.simulation.event.Event;
import com.realm.simulation.event.EventTypes;
import com.realm.simulation.time.TimeManager;
import com.realm.simulation.world.World;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 活的NPC
 *
 * 每个tick先更新需求（体力/饥饿/心情），再检查紧急需求，最后执行当前活动的状态逻辑。
 *
 * <pre>
 * Idle ──夜间且体力&lt;60──▶ Sleeping ──体力&gt;90 或 (体力&gt;50 且工作时间)──▶ Idle
 * Idle ──工作时间且职业上班──▶ Working ──非工作时间 或 体力&lt;30──▶ Idle
 * Idle ──饥饿&gt;50──▶ Eating ──饥饿&lt;20──▶ Idle
 * Idle ──10%──▶ Socializing ──累计超过10分钟──▶ Idle
 * moveTo ──▶ Traveling ──进度≥1──▶ Idle
 * </pre>
 */
public class LivingNpc implements Entity<NpcState> {

    private static final Logger logger = LoggerFactory.getLogger(LivingNpc.class);

    public static final double MAX_NEED = 100.0;
    public static final int MAX_MEMORY = 20;

    static final double WORK_ENERGY_RATE = 0.15;
    static final double IDLE_ENERGY_RATE = 0.05;
    static final double SLEEP_ENERGY_RATE = 0.5;
    static final double HUNGER_RATE = 0.1;
    static final double EAT_HUNGER_RATE = 1.0;
    static final double EAT_ENERGY_RATE = 0.2;
    static final double MOOD_DECAY_RATE = 0.1;
    static final double MOOD_RECOVERY_RATE = 0.05;
    static final double CRAFT_CHANCE_PER_MINUTE = 0.01;
    static final double SOCIALIZE_CHANCE = 0.1;
    static final double TRAVEL_MINUTES = 60.0;
    static final double SOCIALIZE_MINUTES = 10.0;

    private final String id;
    private final GeneratedNpc npc;
    private String currentLocationId;
    private String destinationLocationId;
    private String workLocationId;
    private NpcActivity activity = NpcActivity.IDLE;
    private double travelProgress;
    private double energy = MAX_NEED;
    private double hunger;
    private double mood = 50.0;
    private int gold;
    private double socializingMinutes;
    private final Deque<String> memory = new ArrayDeque<>();
    private final List<Item> inventory = new ArrayList<>();
    private boolean active = true;
    private double lastUpdate;

    public LivingNpc(String id, GeneratedNpc npc, String locationId, int gold) {
        this.id = id;
        this.npc = npc;
        this.currentLocationId = locationId;
        this.workLocationId = locationId;
        this.gold = gold;
        if (npc.getInventory() != null) {
            inventory.addAll(npc.getInventory());
        }
    }

    @Override
    public void update(double delta, World world) {
        if (!active) {
            return;
        }
        lastUpdate += delta;

        updateNeeds(delta);
        if (handleUrgentNeeds()) {
            return;
        }

        switch (activity) {
            case TRAVELING:
                updateTravel(delta, world);
                break;
            case WORKING:
                updateWork(delta, world);
                break;
            case EATING:
                if (hunger < 20) {
                    activity = NpcActivity.IDLE;
                }
                break;
            case SLEEPING:
                updateSleeping(world.getTime());
                break;
            case SOCIALIZING:
                socializingMinutes += delta;
                if (socializingMinutes > SOCIALIZE_MINUTES) {
                    activity = NpcActivity.IDLE;
                }
                break;
            default:
                decideActivity(world);
                break;
        }
    }

    private void updateNeeds(double delta) {
        if (activity == NpcActivity.WORKING) {
            energy -= delta * WORK_ENERGY_RATE;
        } else if (activity == NpcActivity.SLEEPING) {
            energy += delta * SLEEP_ENERGY_RATE;
        } else {
            energy -= delta * IDLE_ENERGY_RATE;
        }

        hunger += delta * HUNGER_RATE;
        if (activity == NpcActivity.EATING) {
            hunger -= delta * EAT_HUNGER_RATE;
            energy += delta * EAT_ENERGY_RATE;
        }

        energy = clamp(energy);
        hunger = clamp(hunger);

        if (energy < 30 || hunger > 70) {
            mood -= delta * MOOD_DECAY_RATE;
        } else {
            mood += delta * MOOD_RECOVERY_RATE;
        }
        mood = clamp(mood);
    }

    /**
     * 体力&lt;20 强制睡觉，否则饥饿&gt;80 强制吃饭；命中时跳过本tick的其余逻辑
     */
    private boolean handleUrgentNeeds() {
        if (energy < 20) {
            if (activity != NpcActivity.SLEEPING) {
                startSleeping();
            }
            return true;
        }
        if (hunger > 80) {
            if (activity != NpcActivity.EATING) {
                startEating();
            }
            return true;
        }
        return false;
    }

    private void decideActivity(World world) {
        TimeManager time = world.getTime();

        if (!time.isDaytime() && energy < 60) {
            startSleeping();
            return;
        }
        if (time.isWorkingHours() && shouldWork(world.getGenerator().getTemplates())) {
            startWorking(world);
            return;
        }
        if (hunger > 50) {
            startEating();
            return;
        }
        if (world.getRandom().chance(SOCIALIZE_CHANCE)) {
            startSocializing();
            return;
        }
        activity = NpcActivity.IDLE;
    }

    private boolean shouldWork(TemplateStore templates) {
        for (String profession : professions()) {
            if (templates.getProfession(profession).isWorks()) {
                return true;
            }
        }
        return false;
    }

    private void updateWork(double delta, World world) {
        if (!world.getTime().isWorkingHours() || energy < 30) {
            activity = NpcActivity.IDLE;
            return;
        }
        List<String> craftTemplates = craftTemplates(world.getGenerator().getTemplates());
        if (!craftTemplates.isEmpty() && world.getRandom().chance(delta * CRAFT_CHANCE_PER_MINUTE)) {
            craft(world.getRandom().choice(craftTemplates), world);
        }
    }

    /**
     * 第一个会制作物品的职业决定制作内容
     */
    private List<String> craftTemplates(TemplateStore templates) {
        for (String profession : professions()) {
            ProfessionTemplate template = templates.getProfession(profession);
            if (!template.getCraftTemplates().isEmpty()) {
                return template.getCraftTemplates();
            }
        }
        return Collections.emptyList();
    }

    private void craft(String template, World world) {
        Item item = world.getGenerator().generateItem(template);
        inventory.add(item);
        addMemory("crafted " + item.getName());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("item_name", item.getName());
        data.put("template", template);
        data.put("crafter", getName());
        world.getEvents().publish(Event.builder()
            .type(EventTypes.ITEM_CRAFTED)
            .sourceId(id)
            .locationId(currentLocationId)
            .data(data)
            .build());
        logger.debug("NPC制作物品: npc={}, item={}", getName(), item.getName());
    }

    private void updateSleeping(TimeManager time) {
        if (energy > 90) {
            activity = NpcActivity.IDLE;
        } else if (time.isWorkingHours() && energy > 50) {
            activity = NpcActivity.IDLE;
        }
    }

    private void updateTravel(double delta, World world) {
        travelProgress += delta / TRAVEL_MINUTES;
        if (travelProgress < 1.0) {
            return;
        }

        String from = currentLocationId;
        String to = destinationLocationId;
        LivingLocation origin = from != null ? world.getLocation(from) : null;
        if (origin != null) {
            origin.removeNpc(id, world.getEvents());
        }
        LivingLocation destination = to != null ? world.getLocation(to) : null;
        if (destination != null) {
            destination.addNpc(id, world.getEvents());
        }

        currentLocationId = to;
        destinationLocationId = null;
        travelProgress = 0.0;
        activity = NpcActivity.IDLE;
        addMemory("arrived at " + (destination != null ? destination.getName() : to));

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("npc_name", getName());
        data.put("from_location", from);
        world.getEvents().publish(Event.builder()
            .type(EventTypes.NPC_ARRIVED)
            .sourceId(id)
            .locationId(to)
            .data(data)
            .build());
    }

    // ---------------------------------------------------------------- transitions

    /**
     * 开始前往另一个地点，目标为当前地点时不做任何事
     */
    public void moveTo(String locationId, World world) {
        if (locationId == null || locationId.equals(currentLocationId)) {
            return;
        }
        activity = NpcActivity.TRAVELING;
        destinationLocationId = locationId;
        travelProgress = 0.0;

        if (world != null) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("npc_name", getName());
            data.put("destination", locationId);
            world.getEvents().publish(Event.builder()
                .type(EventTypes.NPC_STARTED_TRAVELING)
                .sourceId(id)
                .locationId(currentLocationId)
                .data(data)
                .build());
        }
    }

    public void startWorking(World world) {
        activity = NpcActivity.WORKING;
        if (world != null) {
            world.getEvents().publish(Event.builder()
                .type(EventTypes.NPC_STARTED_WORKING)
                .sourceId(id)
                .locationId(currentLocationId)
                .data(Collections.singletonMap("npc_name", getName()))
                .build());
        }
    }

    public void startEating() {
        activity = NpcActivity.EATING;
    }

    public void startSleeping() {
        activity = NpcActivity.SLEEPING;
    }

    public void startSocializing() {
        activity = NpcActivity.SOCIALIZING;
        socializingMinutes = 0;
        mood = clamp(mood + 5);
    }

    public void addMemory(String entry) {
        memory.addLast(entry);
        while (memory.size() > MAX_MEMORY) {
            memory.pollFirst();
        }
    }

    private static double clamp(double value) {
        return Math.max(0, Math.min(MAX_NEED, value));
    }

    // ---------------------------------------------------------------- accessors

    @Override
    public String getId() {
        return id;
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.NPC;
    }

    @Override
    public boolean isActive() {
        return active;
    }

    @Override
    public void destroy() {
        active = false;
    }

    public GeneratedNpc getNpc() {
        return npc;
    }

    public String getName() {
        return npc.getName() != null ? npc.getName() : "Unknown";
    }

    public String getProfession() {
        return npc.primaryProfession();
    }

    private List<String> professions() {
        return npc.getProfessions() != null ? npc.getProfessions() : Collections.emptyList();
    }

    public String getCurrentLocationId() {
        return currentLocationId;
    }

    public String getDestinationLocationId() {
        return destinationLocationId;
    }

    public String getWorkLocationId() {
        return workLocationId;
    }

    public NpcActivity getActivity() {
        return activity;
    }

    public double getTravelProgress() {
        return travelProgress;
    }

    public double getEnergy() {
        return energy;
    }

    public void setEnergy(double energy) {
        this.energy = clamp(energy);
    }

    public double getHunger() {
        return hunger;
    }

    public void setHunger(double hunger) {
        this.hunger = clamp(hunger);
    }

    public double getMood() {
        return mood;
    }

    public void setMood(double mood) {
        this.mood = clamp(mood);
    }

    public int getGold() {
        return gold;
    }

    public List<String> getMemory() {
        return new ArrayList<>(memory);
    }

    public List<Item> getInventory() {
        return Collections.unmodifiableList(inventory);
    }

    // ---------------------------------------------------------------- state

    @Override
    public NpcState serialize() {
        NpcState state = new NpcState();
        state.setId(id);
        state.setActive(active);
        state.setLastUpdate(lastUpdate);
        state.setNpc(npc);
        state.setCurrentLocationId(currentLocationId);
        state.setDestinationLocationId(destinationLocationId);
        state.setWorkLocationId(workLocationId);
        state.setActivity(activity);
        state.setTravelProgress(travelProgress);
        state.setEnergy(energy);
        state.setHunger(hunger);
        state.setMood(mood);
        state.setGold(gold);
        state.setSocializingMinutes(socializingMinutes);
        state.setMemory(new ArrayList<>(memory));
        state.setInventory(new ArrayList<>(inventory));
        return state;
    }

    @Override
    public void deserialize(NpcState state) {
        active = state.isActive();
        lastUpdate = state.getLastUpdate();
        currentLocationId = state.getCurrentLocationId();
        destinationLocationId = state.getDestinationLocationId();
        workLocationId = state.getWorkLocationId();
        activity = state.getActivity() != null ? state.getActivity() : NpcActivity.IDLE;
        travelProgress = state.getTravelProgress();
        energy = state.getEnergy();
        hunger = state.getHunger();
        mood = state.getMood();
        gold = state.getGold();
        socializingMinutes = state.getSocializingMinutes();
        memory.clear();
        if (state.getMemory() != null) {
            state.getMemory().forEach(this::addMemory);
        }
        inventory.clear();
        if (state.getInventory() != null) {
            inventory.addAll(state.getInventory());
        }
    }

    @Override
    public String toString() {
        return "LivingNpc{id=" + id + ", name=" + getName() + ", activity=" + activity + "}";
    }
}
