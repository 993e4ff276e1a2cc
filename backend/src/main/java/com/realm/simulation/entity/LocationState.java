package com.realm.simulation.entity;

import com.realm.generator.model.GeneratedLocation;
import com.realm.generator.model.Item;
import com.realm.generator.model.Weather;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class LocationState extends EntityState {

    private GeneratedLocation location;

    private List<String> npcIds = new ArrayList<>();

    /**
     * 物品ID → 物品
     */
    private Map<String, Item> items = new LinkedHashMap<>();

    private Weather currentWeather;

    private Long weatherHour;

    private boolean marketOpen;
}
