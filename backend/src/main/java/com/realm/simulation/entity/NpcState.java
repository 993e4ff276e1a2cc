package com.realm.simulation.entity;

import com.realm.generator.model.GeneratedNpc;
import com.realm.generator.model.Item;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class NpcState extends EntityState {

    private GeneratedNpc npc;

    private String currentLocationId;

    private String destinationLocationId;

    private String workLocationId;

    private NpcActivity activity = NpcActivity.IDLE;

    private double travelProgress;

    private double energy = LivingNpc.MAX_NEED;

    private double hunger;

    private double mood = 50.0;

    private int gold;

    private double socializingMinutes;

    private List<String> memory = new ArrayList<>();

    /**
     * 模拟中的库存，包含生成时的物品和之后制作的物品
     */
    private List<Item> inventory = new ArrayList<>();
}
