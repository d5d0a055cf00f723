package com.vigil.query;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The same set of processes ranked two ways, highest usage first
 */
public final class ProcessRanking {
    
    private final List<ProcessUsage> byMemory;
    private final List<ProcessUsage> byCpu;
    
    public ProcessRanking(List<ProcessUsage> byMemory, List<ProcessUsage> byCpu) {
        this.byMemory = List.copyOf(byMemory);
        this.byCpu = List.copyOf(byCpu);
    }
    
    @JsonProperty("by_memory")
    public List<ProcessUsage> getByMemory() {
        return byMemory;
    }
    
    @JsonProperty("by_cpu")
    public List<ProcessUsage> getByCpu() {
        return byCpu;
    }
}
