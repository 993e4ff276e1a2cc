package com.realm.generator;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * 描述模板填充
 *
 * 替换所有 {name} 占位符；值表中没有的占位符直接删除，不作为错误处理。
 */
public final class TemplateFiller {

    private static final Pattern LEFTOVER = Pattern.compile("\\{[^}]+}");
    private static final Pattern SPACES = Pattern.compile(" {2,}");

    private TemplateFiller() {
    }

    public static String fill(String template, Map<String, ?> values) {
        if (template == null) {
            return "";
        }
        String result = template;
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            Object value = entry.getValue();
            result = result.replace("{" + entry.getKey() + "}", value != null ? value.toString() : "");
        }
        result = LEFTOVER.matcher(result).replaceAll("");
        return SPACES.matcher(result).replaceAll(" ").trim();
    }
}
