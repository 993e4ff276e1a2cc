package com.realm.dto;

import lombok.Data;

import javax.validation.constraints.NotBlank;
import java.util.List;

@Data
public class SpawnNpcRequest {

    @NotBlank
    private String locationId;

    private List<String> professions;

    private String race;
}
