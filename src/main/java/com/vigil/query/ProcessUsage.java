package com.vigil.query;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.OptionalDouble;

/**
 * Resource usage of one process, taken from a process log record
 */
public final class ProcessUsage {
    
    private final String name;
    private final Double cpuPercent;
    private final Double memoryPercent;
    
    public ProcessUsage(String name, Double cpuPercent, Double memoryPercent) {
        this.name = name;
        this.cpuPercent = cpuPercent;
        this.memoryPercent = memoryPercent;
    }
    
    @JsonProperty("name")
    public String getName() {
        return name;
    }
    
    @JsonProperty("cpu_percent")
    public OptionalDouble getCpuPercent() {
        return cpuPercent != null ? OptionalDouble.of(cpuPercent) : OptionalDouble.empty();
    }
    
    @JsonProperty("memory_percent")
    public OptionalDouble getMemoryPercent() {
        return memoryPercent != null ? OptionalDouble.of(memoryPercent) : OptionalDouble.empty();
    }
    
    @Override
    public String toString() {
        return "ProcessUsage{" + name + ", cpu=" + cpuPercent + ", memory=" + memoryPercent + "}";
    }
}
