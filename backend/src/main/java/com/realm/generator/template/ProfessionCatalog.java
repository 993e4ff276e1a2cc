package com.realm.generator.template;

import lombok.Data;

import java.util.LinkedHashMap;

/**
 * professions.json
 */
@Data
public class ProfessionCatalog {

    private LinkedHashMap<String, ProfessionTemplate> professions = new LinkedHashMap<>();

    private GenericNpcTemplate generic = new GenericNpcTemplate();
}
