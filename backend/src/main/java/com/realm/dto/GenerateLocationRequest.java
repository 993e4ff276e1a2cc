package com.realm.dto;

import lombok.Data;

import javax.validation.constraints.Max;
import javax.validation.constraints.Min;

@Data
public class GenerateLocationRequest {

    private String template;

    private boolean connect = true;

    @Min(0)
    @Max(10)
    private int maxConnections = 3;

    private String biome;
}
