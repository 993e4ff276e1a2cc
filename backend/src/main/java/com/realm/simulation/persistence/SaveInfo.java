package com.realm.simulation.persistence;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SaveInfo {

    /**
     * 不含扩展名的存档名
     */
    String name;

    String fileName;

    SnapshotFormat format;

    boolean compressed;

    long size;

    long modifiedAt;
}
