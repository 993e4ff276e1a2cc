package com.realm.dto;

import lombok.Data;

import javax.validation.constraints.Max;
import javax.validation.constraints.Min;

@Data
public class StepRequest {

    /**
     * 推进的模拟分钟数
     */
    @Min(1)
    @Max(43200)
    private int minutes = 60;

    /**
     * 分几步推进，每步 minutes / steps 分钟
     */
    @Min(1)
    @Max(1440)
    private int steps = 1;
}
