package com.realm.dto;

import com.realm.generator.model.Item;
import com.realm.simulation.entity.LivingNpc;
import com.realm.simulation.entity.NpcActivity;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * NPC对外展示视图
 */
@Value
@Builder
public class NpcView {

    String id;
    String name;
    String title;
    List<String> professions;
    String race;
    String faction;
    Map<String, Integer> stats;
    List<String> skills;
    String locationId;
    String destinationId;
    NpcActivity activity;
    double travelProgress;
    double energy;
    double hunger;
    double mood;
    int gold;
    boolean active;
    List<String> memory;
    List<Item> inventory;

    public static NpcView of(LivingNpc npc) {
        return NpcView.builder()
            .id(npc.getId())
            .name(npc.getName())
            .title(npc.getNpc().getTitle())
            .professions(npc.getNpc().getProfessions())
            .race(npc.getNpc().getRace())
            .faction(npc.getNpc().getFaction())
            .stats(npc.getNpc().getStats())
            .skills(npc.getNpc().getSkills())
            .locationId(npc.getCurrentLocationId())
            .destinationId(npc.getDestinationLocationId())
            .activity(npc.getActivity())
            .travelProgress(npc.getTravelProgress())
            .energy(npc.getEnergy())
            .hunger(npc.getHunger())
            .mood(npc.getMood())
            .gold(npc.getGold())
            .active(npc.isActive())
            .memory(npc.getMemory())
            .inventory(npc.getInventory())
            .build();
    }
}
