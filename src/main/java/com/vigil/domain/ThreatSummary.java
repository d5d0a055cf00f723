package com.vigil.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Threat overview from the threats source.
 * {@code topThreats} is ordered by count, highest first.
 */
public final class ThreatSummary {
    
    private final long totalAlerts;
    private final Long alertsLastHour;
    private final Long alertsLastDay;
    private final Map<String, Long> severityCounts;
    private final List<ThreatCount> topThreats;
    
    public ThreatSummary(long totalAlerts, Long alertsLastHour, Long alertsLastDay,
                         Map<String, Long> severityCounts, List<ThreatCount> topThreats) {
        this.totalAlerts = totalAlerts;
        this.alertsLastHour = alertsLastHour;
        this.alertsLastDay = alertsLastDay;
        this.severityCounts = severityCounts != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(severityCounts))
            : Map.of();
        this.topThreats = topThreats != null ? List.copyOf(topThreats) : List.of();
    }
    
    @JsonProperty("total_alerts")
    public long getTotalAlerts() {
        return totalAlerts;
    }
    
    @JsonProperty("alerts_last_hour")
    public OptionalLong getAlertsLastHour() {
        return alertsLastHour != null ? OptionalLong.of(alertsLastHour) : OptionalLong.empty();
    }
    
    @JsonProperty("alerts_last_day")
    public OptionalLong getAlertsLastDay() {
        return alertsLastDay != null ? OptionalLong.of(alertsLastDay) : OptionalLong.empty();
    }
    
    @JsonProperty("severity_counts")
    public Map<String, Long> getSeverityCounts() {
        return severityCounts;
    }
    
    @JsonProperty("top_threats")
    public List<ThreatCount> getTopThreats() {
        return topThreats;
    }
    
    /**
     * The most frequent threat, absent when none was reported
     */
    @JsonProperty("top_threat")
    public Optional<ThreatCount> getTopThreat() {
        return topThreats.isEmpty() ? Optional.empty() : Optional.of(topThreats.get(0));
    }
}
