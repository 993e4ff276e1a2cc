package com.realm.generator.template;

import com.realm.generator.Weighted;
import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class NamedWeight implements Weighted {

    @JsonAlias("condition")
    private String name;

    private Double weight;
}
