package com.vigil.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Alert totals broken down by alert type and by severity.
 */
public final class AlertSummary {
    
    private final long totalAlerts;
    private final Map<String, Long> byType;
    private final Map<String, Long> bySeverity;
    
    public AlertSummary(long totalAlerts, Map<String, Long> byType, Map<String, Long> bySeverity) {
        this.totalAlerts = totalAlerts;
        this.byType = byType != null ? Collections.unmodifiableMap(new LinkedHashMap<>(byType)) : Map.of();
        this.bySeverity = bySeverity != null ? Collections.unmodifiableMap(new LinkedHashMap<>(bySeverity)) : Map.of();
    }
    
    @JsonProperty("total_alerts")
    public long getTotalAlerts() {
        return totalAlerts;
    }
    
    @JsonProperty("by_type")
    public Map<String, Long> getByType() {
        return byType;
    }
    
    @JsonProperty("by_severity")
    public Map<String, Long> getBySeverity() {
        return bySeverity;
    }
}
