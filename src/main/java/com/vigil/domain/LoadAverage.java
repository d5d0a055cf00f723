package com.vigil.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.OptionalDouble;

/**
 * System load averages over 1, 5 and 15 minutes.
 * Each figure is absent when the source did not report it.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public final class LoadAverage {
    
    private final Double oneMinute;
    private final Double fiveMinutes;
    private final Double fifteenMinutes;
    
    public LoadAverage(Double oneMinute, Double fiveMinutes, Double fifteenMinutes) {
        this.oneMinute = oneMinute;
        this.fiveMinutes = fiveMinutes;
        this.fifteenMinutes = fifteenMinutes;
    }
    
    public OptionalDouble getOneMinute() {
        return oneMinute != null ? OptionalDouble.of(oneMinute) : OptionalDouble.empty();
    }
    
    public OptionalDouble getFiveMinutes() {
        return fiveMinutes != null ? OptionalDouble.of(fiveMinutes) : OptionalDouble.empty();
    }
    
    public OptionalDouble getFifteenMinutes() {
        return fifteenMinutes != null ? OptionalDouble.of(fifteenMinutes) : OptionalDouble.empty();
    }
}
