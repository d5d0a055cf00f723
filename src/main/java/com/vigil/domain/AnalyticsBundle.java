package com.vigil.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Aggregated analytics served by the analytics source: usage time series,
 * protocol and port breakdowns, and overall counters.
 */
public final class AnalyticsBundle {
    
    private final AnalyticsTimeSeries timeSeries;
    private final List<ProtocolShare> protocols;
    private final List<PortCount> topPorts;
    private final long alertsCount;
    private final long networkPacketsCount;
    private final long totalLogEntries;
    
    public AnalyticsBundle(AnalyticsTimeSeries timeSeries, List<ProtocolShare> protocols,
                           List<PortCount> topPorts, long alertsCount,
                           long networkPacketsCount, long totalLogEntries) {
        this.timeSeries = Objects.requireNonNull(timeSeries, "timeSeries");
        this.protocols = protocols != null ? List.copyOf(protocols) : List.of();
        this.topPorts = topPorts != null ? List.copyOf(topPorts) : List.of();
        this.alertsCount = alertsCount;
        this.networkPacketsCount = networkPacketsCount;
        this.totalLogEntries = totalLogEntries;
    }
    
    @JsonProperty("time_series")
    public AnalyticsTimeSeries getTimeSeries() {
        return timeSeries;
    }
    
    @JsonProperty("protocols")
    public List<ProtocolShare> getProtocols() {
        return protocols;
    }
    
    @JsonProperty("top_ports")
    public List<PortCount> getTopPorts() {
        return topPorts;
    }
    
    @JsonProperty("alerts_count")
    public long getAlertsCount() {
        return alertsCount;
    }
    
    @JsonProperty("network_packets_count")
    public long getNetworkPacketsCount() {
        return networkPacketsCount;
    }
    
    @JsonProperty("total_log_entries")
    public long getTotalLogEntries() {
        return totalLogEntries;
    }
}
