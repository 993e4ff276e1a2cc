package com.realm.simulation.entity;

import com.realm.generator.model.GeneratedLocation;
import com.realm.generator.model.Item;
import com.realm.generator.model.Weather;
import com.realm.simulation.event.Event;
import com.realm.simulation.event.EventBus;
import com.realm.simulation.event.EventTypes;
import com.realm.simulation.time.TimeManager;
import com.realm.simulation.world.World;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 活的地点
 *
 * 包装生成的地点，记录当前在场的NPC与物品。
 * 天气每个模拟小时重算一次，市场开闭随工作时间变化，只在状态翻转时发事件。
 */
public class LivingLocation implements Entity<LocationState> {

    /**
     * 有市场开闭状态的地点类型
     */
    public static final Set<String> MARKET_TYPES = Collections.unmodifiableSet(
        new HashSet<>(Arrays.asList("building", "market")));

    private final String id;
    private final GeneratedLocation location;
    private final Set<String> npcIds = new LinkedHashSet<>();
    private final Map<String, Item> items = new LinkedHashMap<>();
    private Weather currentWeather;
    private Long weatherHour;
    private boolean marketOpen;
    private boolean active = true;
    private double lastUpdate;

    public LivingLocation(String id, GeneratedLocation location) {
        this.id = id;
        this.location = location;
    }

    @Override
    public void update(double delta, World world) {
        if (!active) {
            return;
        }
        lastUpdate += delta;

        long hour = world.getTime().getTotalMinutes() / TimeManager.MINUTES_PER_HOUR;
        if (currentWeather == null || weatherHour == null || hour != weatherHour) {
            updateWeather(world);
            weatherHour = hour;
        }
        updateMarket(world);
    }

    private void updateWeather(World world) {
        TimeManager time = world.getTime();
        Weather next = world.getGenerator().generateWeather(
            getBiome(), time.getSeason().getKey(), time.getTimeOfDay().getKey());
        Weather previous = currentWeather;
        currentWeather = next;

        if (previous != null && !previous.getCondition().equals(next.getCondition())) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("location_name", getName());
            data.put("from", previous.getCondition());
            data.put("to", next.getCondition());
            world.getEvents().publish(Event.builder()
                .type(EventTypes.WEATHER_CHANGED)
                .locationId(id)
                .data(data)
                .build());
        }
    }

    private void updateMarket(World world) {
        if (!MARKET_TYPES.contains(getType())) {
            return;
        }
        boolean shouldBeOpen = world.getTime().isWorkingHours();
        if (shouldBeOpen == marketOpen) {
            return;
        }
        marketOpen = shouldBeOpen;
        world.getEvents().publish(Event.builder()
            .type(shouldBeOpen ? EventTypes.MARKET_OPENED : EventTypes.MARKET_CLOSED)
            .locationId(id)
            .data(Collections.singletonMap("location_name", getName()))
            .build());
    }

    // ---------------------------------------------------------------- membership

    /**
     * @param events 为空时不发布进入事件
     */
    public void addNpc(String npcId, EventBus events) {
        npcIds.add(npcId);
        if (events != null) {
            events.publish(Event.builder()
                .type(EventTypes.NPC_ENTERED_LOCATION)
                .sourceId(npcId)
                .locationId(id)
                .data(Collections.singletonMap("location_name", getName()))
                .build());
        }
    }

    public void removeNpc(String npcId, EventBus events) {
        npcIds.remove(npcId);
        if (events != null) {
            events.publish(Event.builder()
                .type(EventTypes.NPC_EXITED_LOCATION)
                .sourceId(npcId)
                .locationId(id)
                .data(Collections.singletonMap("location_name", getName()))
                .build());
        }
    }

    public void addItem(String itemId, Item item) {
        items.put(itemId, item);
    }

    public Item removeItem(String itemId) {
        return items.remove(itemId);
    }

    public boolean hasNpc(String npcId) {
        return npcIds.contains(npcId);
    }

    public Set<String> getNpcIds() {
        return Collections.unmodifiableSet(npcIds);
    }

    public int getNpcCount() {
        return npcIds.size();
    }

    public Set<String> getItemIds() {
        return Collections.unmodifiableSet(items.keySet());
    }

    public Map<String, Item> getItems() {
        return Collections.unmodifiableMap(items);
    }

    // ---------------------------------------------------------------- accessors

    @Override
    public String getId() {
        return id;
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.LOCATION;
    }

    @Override
    public boolean isActive() {
        return active;
    }

    @Override
    public void destroy() {
        active = false;
    }

    public GeneratedLocation getLocation() {
        return location;
    }

    public String getName() {
        return location.getName() != null ? location.getName() : "Unknown Location";
    }

    public String getType() {
        return location.getType() != null ? location.getType() : "unknown";
    }

    public String getBiome() {
        return location.getBiome() != null ? location.getBiome() : "temperate_forest";
    }

    public Map<String, String> getConnections() {
        return location.getConnections() != null ? location.getConnections() : Collections.emptyMap();
    }

    public Weather getCurrentWeather() {
        return currentWeather;
    }

    public boolean isMarketOpen() {
        return marketOpen;
    }

    // ---------------------------------------------------------------- state

    @Override
    public LocationState serialize() {
        LocationState state = new LocationState();
        state.setId(id);
        state.setActive(active);
        state.setLastUpdate(lastUpdate);
        state.setLocation(location);
        state.setNpcIds(new ArrayList<>(npcIds));
        state.setItems(new LinkedHashMap<>(items));
        state.setCurrentWeather(currentWeather);
        state.setWeatherHour(weatherHour);
        state.setMarketOpen(marketOpen);
        return state;
    }

    @Override
    public void deserialize(LocationState state) {
        active = state.isActive();
        lastUpdate = state.getLastUpdate();
        npcIds.clear();
        if (state.getNpcIds() != null) {
            npcIds.addAll(state.getNpcIds());
        }
        items.clear();
        if (state.getItems() != null) {
            items.putAll(state.getItems());
        }
        currentWeather = state.getCurrentWeather();
        weatherHour = state.getWeatherHour();
        marketOpen = state.isMarketOpen();
    }

    @Override
    public String toString() {
        return "LivingLocation{id=" + id + ", name=" + getName() + ", npcs=" + npcIds.size() + "}";
    }
}
