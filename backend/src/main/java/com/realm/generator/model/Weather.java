package com.realm.generator.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class Weather {

    String condition;

    int temperature;

    String season;

    String timeOfDay;
}
