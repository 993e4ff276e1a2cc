package com.realm.generator.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * 一次生成会话得到的世界图
 */
@Value
@Builder
@Jacksonized
public class GeneratedWorld {

    Map<String, GeneratedLocation> locations;

    Map<String, LocationSummary> summary;
}
