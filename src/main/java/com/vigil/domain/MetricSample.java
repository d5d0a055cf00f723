package com.vigil.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * One host metrics sample from the metrics source.
 * 
 * Only the timestamp is mandatory. Every other figure is absent (not zero)
 * when the source omitted it, so "no data" can be told apart from a measured value.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public final class MetricSample {
    
    private final Instant timestamp;
    private final Double cpuPercent;
    private final Double memoryPercent;
    private final LoadAverage load;
    private final Double swapPercent;
    private final Double diskPercent;
    private final Long processCount;
    private final Double memoryUsedMb;
    private final Double memoryTotalMb;
    private final CpuBreakdown cpuBreakdown;
    
    private MetricSample(Builder builder) {
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp");
        this.cpuPercent = builder.cpuPercent;
        this.memoryPercent = builder.memoryPercent;
        this.load = builder.load;
        this.swapPercent = builder.swapPercent;
        this.diskPercent = builder.diskPercent;
        this.processCount = builder.processCount;
        this.memoryUsedMb = builder.memoryUsedMb;
        this.memoryTotalMb = builder.memoryTotalMb;
        this.cpuBreakdown = builder.cpuBreakdown;
    }
    
    public static Builder builder(Instant timestamp) {
        return new Builder(timestamp);
    }
    
    public Instant getTimestamp() {
        return timestamp;
    }
    
    public OptionalDouble getCpuPercent() {
        return of(cpuPercent);
    }
    
    public OptionalDouble getMemoryPercent() {
        return of(memoryPercent);
    }
    
    public Optional<LoadAverage> getLoad() {
        return Optional.ofNullable(load);
    }
    
    public OptionalDouble getSwapPercent() {
        return of(swapPercent);
    }
    
    public OptionalDouble getDiskPercent() {
        return of(diskPercent);
    }
    
    public OptionalLong getProcessCount() {
        return processCount != null ? OptionalLong.of(processCount) : OptionalLong.empty();
    }
    
    public OptionalDouble getMemoryUsedMb() {
        return of(memoryUsedMb);
    }
    
    public OptionalDouble getMemoryTotalMb() {
        return of(memoryTotalMb);
    }
    
    public Optional<CpuBreakdown> getCpuBreakdown() {
        return Optional.ofNullable(cpuBreakdown);
    }
    
    private static OptionalDouble of(Double value) {
        return value != null ? OptionalDouble.of(value) : OptionalDouble.empty();
    }
    
    /**
     * Builder for MetricSample; unset figures stay absent
     */
    public static final class Builder {
        private final Instant timestamp;
        private Double cpuPercent;
        private Double memoryPercent;
        private LoadAverage load;
        private Double swapPercent;
        private Double diskPercent;
        private Long processCount;
        private Double memoryUsedMb;
        private Double memoryTotalMb;
        private CpuBreakdown cpuBreakdown;
        
        private Builder(Instant timestamp) {
            this.timestamp = timestamp;
        }
        
        public Builder cpuPercent(Double cpuPercent) {
            this.cpuPercent = cpuPercent;
            return this;
        }
        
        public Builder memoryPercent(Double memoryPercent) {
            this.memoryPercent = memoryPercent;
            return this;
        }
        
        public Builder load(LoadAverage load) {
            this.load = load;
            return this;
        }
        
        public Builder swapPercent(Double swapPercent) {
            this.swapPercent = swapPercent;
            return this;
        }
        
        public Builder diskPercent(Double diskPercent) {
            this.diskPercent = diskPercent;
            return this;
        }
        
        public Builder processCount(Long processCount) {
            this.processCount = processCount;
            return this;
        }
        
        public Builder memoryUsedMb(Double memoryUsedMb) {
            this.memoryUsedMb = memoryUsedMb;
            return this;
        }
        
        public Builder memoryTotalMb(Double memoryTotalMb) {
            this.memoryTotalMb = memoryTotalMb;
            return this;
        }
        
        public Builder cpuBreakdown(CpuBreakdown cpuBreakdown) {
            this.cpuBreakdown = cpuBreakdown;
            return this;
        }
        
        public MetricSample build() {
            return new MetricSample(this);
        }
    }
}
