package com.realm.generator.template;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class SeasonClimate {

    private IntRange temperature = new IntRange(10, 20);

    private List<NamedWeight> conditions = new ArrayList<>();
}
