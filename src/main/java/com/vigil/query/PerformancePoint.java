package com.vigil.query;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * CPU and memory usage at one instant of the analytics time series
 */
public final class PerformancePoint {
    
    private final Instant timestamp;
    private final double cpu;
    private final double memory;
    
    public PerformancePoint(Instant timestamp, double cpu, double memory) {
        this.timestamp = timestamp;
        this.cpu = cpu;
        this.memory = memory;
    }
    
    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }
    
    @JsonProperty("cpu")
    public double getCpu() {
        return cpu;
    }
    
    @JsonProperty("memory")
    public double getMemory() {
        return memory;
    }
}
