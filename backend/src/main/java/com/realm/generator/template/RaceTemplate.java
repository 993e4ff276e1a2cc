package com.realm.generator.template;

import com.realm.generator.Weighted;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

@Data
public class RaceTemplate implements Weighted {

    private String name;

    private Double weight;

    private LinkedHashMap<String, Integer> statModifiers = new LinkedHashMap<>();

    private List<String> firstNames = new ArrayList<>();

    private List<String> lastNames = new ArrayList<>();
}
