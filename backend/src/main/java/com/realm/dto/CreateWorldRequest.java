package com.realm.dto;

import lombok.Data;

import javax.validation.constraints.Max;
import javax.validation.constraints.Min;

/**
 * 创建模拟世界请求，字段为空时使用配置默认值
 */
@Data
public class CreateWorldRequest {

    private String name;

    @Min(0)
    @Max(100)
    private Integer locations;

    private Long seed;
}
