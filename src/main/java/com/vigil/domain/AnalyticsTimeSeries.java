package com.vigil.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Parallel arrays of CPU and memory usage over time, as served by the analytics source.
 * The arrays are not guaranteed to have equal lengths.
 */
public final class AnalyticsTimeSeries {
    
    private final List<Instant> timestamps;
    private final List<Double> cpu;
    private final List<Double> memory;
    
    public AnalyticsTimeSeries(List<Instant> timestamps, List<Double> cpu, List<Double> memory) {
        this.timestamps = timestamps != null ? List.copyOf(timestamps) : List.of();
        this.cpu = cpu != null ? List.copyOf(cpu) : List.of();
        this.memory = memory != null ? List.copyOf(memory) : List.of();
    }
    
    public static AnalyticsTimeSeries empty() {
        return new AnalyticsTimeSeries(List.of(), List.of(), List.of());
    }
    
    @JsonProperty("timestamps")
    public List<Instant> getTimestamps() {
        return timestamps;
    }
    
    @JsonProperty("cpu")
    public List<Double> getCpu() {
        return cpu;
    }
    
    @JsonProperty("memory")
    public List<Double> getMemory() {
        return memory;
    }
}
