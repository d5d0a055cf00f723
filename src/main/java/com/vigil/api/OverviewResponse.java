package com.vigil.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vigil.domain.AlertSummary;
import com.vigil.domain.MetricSample;
import com.vigil.domain.NetworkSample;
import com.vigil.domain.SystemStatus;
import com.vigil.domain.ThreatSummary;
import com.vigil.query.ProcessRanking;

import java.util.Map;
import java.util.Optional;

/**
 * Everything the overview view shows. Absent values serialize as null,
 * and {@code sources} tells a never-fetched value from a stale one.
 */
public class OverviewResponse {
    
    @JsonProperty("status")
    private final Optional<SystemStatus> status;
    
    @JsonProperty("latest_metrics")
    private final Optional<MetricSample> latestMetrics;
    
    @JsonProperty("latest_network")
    private final Optional<NetworkSample> latestNetwork;
    
    @JsonProperty("processes")
    private final ProcessRanking processes;
    
    @JsonProperty("alert_summary")
    private final Optional<AlertSummary> alertSummary;
    
    @JsonProperty("threat_summary")
    private final Optional<ThreatSummary> threatSummary;
    
    @JsonProperty("top_threat")
    private final Optional<String> topThreat;
    
    @JsonProperty("log_severity_counts")
    private final Map<String, Long> logSeverityCounts;
    
    @JsonProperty("sources")
    private final Map<String, SlotView> sources;
    
    public OverviewResponse(Optional<SystemStatus> status, Optional<MetricSample> latestMetrics,
                            Optional<NetworkSample> latestNetwork, ProcessRanking processes,
                            Optional<AlertSummary> alertSummary, Optional<ThreatSummary> threatSummary,
                            Optional<String> topThreat, Map<String, Long> logSeverityCounts,
                            Map<String, SlotView> sources) {
        this.status = status;
        this.latestMetrics = latestMetrics;
        this.latestNetwork = latestNetwork;
        this.processes = processes;
        this.alertSummary = alertSummary;
        this.threatSummary = threatSummary;
        this.topThreat = topThreat;
        this.logSeverityCounts = logSeverityCounts;
        this.sources = sources;
    }
    
    public Optional<SystemStatus> getStatus() {
        return status;
    }
    
    public Optional<MetricSample> getLatestMetrics() {
        return latestMetrics;
    }
    
    public Optional<NetworkSample> getLatestNetwork() {
        return latestNetwork;
    }
    
    public ProcessRanking getProcesses() {
        return processes;
    }
    
    public Optional<AlertSummary> getAlertSummary() {
        return alertSummary;
    }
    
    public Optional<ThreatSummary> getThreatSummary() {
        return threatSummary;
    }
    
    public Optional<String> getTopThreat() {
        return topThreat;
    }
    
    public Map<String, Long> getLogSeverityCounts() {
        return logSeverityCounts;
    }
    
    public Map<String, SlotView> getSources() {
        return sources;
    }
}
