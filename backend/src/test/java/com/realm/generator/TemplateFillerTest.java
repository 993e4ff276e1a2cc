package com.realm.generator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateFillerTest {

    @Test
    @DisplayName("替换已知占位符")
    void replacesKnownPlaceholders() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("name", "Mara");
        values.put("trait", "curious");
        assertThat(TemplateFiller.fill("{name} is {trait}.", values)).isEqualTo("Mara is curious.");
    }

    @Test
    @DisplayName("未知占位符被删除，多余空格被合并")
    void dropsUnknownPlaceholders() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("material", "iron");
        assertThat(TemplateFiller.fill("A {quality} {material} blade", values)).isEqualTo("A iron blade");
    }

    @Test
    @DisplayName("模板为null时返回空串")
    void nullTemplateGivesEmptyString() {
        assertThat(TemplateFiller.fill(null, Map.of())).isEmpty();
    }
}
