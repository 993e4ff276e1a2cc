package com.realm.simulation.persistence;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 存档文件的顶层结构：{version, timestamp, compressed, world_state}
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class WorldSnapshot {

    private String version;

    private String timestamp;

    private boolean compressed;

    private WorldState worldState;
}
