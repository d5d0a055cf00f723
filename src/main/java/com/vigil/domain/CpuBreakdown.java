package com.vigil.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.OptionalDouble;

/**
 * Split of CPU time by state, in percent.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public final class CpuBreakdown {
    
    private final Double user;
    private final Double system;
    private final Double nice;
    private final Double io;
    private final Double softirq;
    private final Double iowait;
    
    public CpuBreakdown(Double user, Double system, Double nice, Double io, Double softirq, Double iowait) {
        this.user = user;
        this.system = system;
        this.nice = nice;
        this.io = io;
        this.softirq = softirq;
        this.iowait = iowait;
    }
    
    public OptionalDouble getUser() {
        return of(user);
    }
    
    public OptionalDouble getSystem() {
        return of(system);
    }
    
    public OptionalDouble getNice() {
        return of(nice);
    }
    
    public OptionalDouble getIo() {
        return of(io);
    }
    
    public OptionalDouble getSoftirq() {
        return of(softirq);
    }
    
    public OptionalDouble getIowait() {
        return of(iowait);
    }
    
    private static OptionalDouble of(Double value) {
        return value != null ? OptionalDouble.of(value) : OptionalDouble.empty();
    }
}
