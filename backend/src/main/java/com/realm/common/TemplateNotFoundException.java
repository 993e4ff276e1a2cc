package com.realm.common;

/**
 * 查找失败：未知的模板、职业、种族、阵营、生物群系、品质/稀有度等级或属性名
 */
public class TemplateNotFoundException extends RealmException {

    private final String category;
    private final String name;

    public TemplateNotFoundException(String category, String name) {
        super("未知的" + category + ": " + name, "TEMPLATE_NOT_FOUND");
        this.category = category;
        this.name = name;
    }

    public String getCategory() {
        return category;
    }

    public String getName() {
        return name;
    }
}
