package com.realm.generator.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class LocationSummary {

    String name;

    String type;

    List<String> connections;

    int npcCount;

    int itemCount;
}
