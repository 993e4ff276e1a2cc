package com.realm.dto;

import lombok.Data;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Pattern;

/**
 * 存档/读档请求
 */
@Data
public class SaveRequest {

    @NotBlank
    @Pattern(regexp = "[A-Za-z0-9_\\-]+")
    private String name;

    /**
     * json 或 yaml
     */
    private String format = "json";

    private boolean compressed = true;
}
