package com.realm.generator.template;

import com.realm.generator.Weighted;
import lombok.Data;

@Data
public class FactionTemplate implements Weighted {

    private String name;

    private Double weight;

    private String description;
}
