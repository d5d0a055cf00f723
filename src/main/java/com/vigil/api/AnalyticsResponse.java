package com.vigil.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vigil.domain.PortCount;
import com.vigil.domain.ProtocolShare;
import com.vigil.query.PerformancePoint;
import com.vigil.query.TrafficPoint;

import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Everything the analytics view shows for the current window
 */
public class AnalyticsResponse {
    
    @JsonProperty("window_seconds")
    private final int windowSeconds;
    
    @JsonProperty("performance")
    private final List<PerformancePoint> performance;
    
    @JsonProperty("protocols")
    private final List<ProtocolShare> protocols;
    
    @JsonProperty("top_ports")
    private final List<PortCount> topPorts;
    
    @JsonProperty("alerts_count")
    private final OptionalLong alertsCount;
    
    @JsonProperty("network_packets_count")
    private final OptionalLong networkPacketsCount;
    
    @JsonProperty("total_log_entries")
    private final OptionalLong totalLogEntries;
    
    @JsonProperty("alerts_by_type")
    private final Map<String, Long> alertsByType;
    
    @JsonProperty("alerts_by_severity")
    private final Map<String, Long> alertsBySeverity;
    
    @JsonProperty("network_traffic")
    private final List<TrafficPoint> networkTraffic;
    
    @JsonProperty("sources")
    private final Map<String, SlotView> sources;
    
    public AnalyticsResponse(int windowSeconds, List<PerformancePoint> performance,
                             List<ProtocolShare> protocols, List<PortCount> topPorts,
                             OptionalLong alertsCount, OptionalLong networkPacketsCount,
                             OptionalLong totalLogEntries, Map<String, Long> alertsByType,
                             Map<String, Long> alertsBySeverity, List<TrafficPoint> networkTraffic,
                             Map<String, SlotView> sources) {
        this.windowSeconds = windowSeconds;
        this.performance = performance;
        this.protocols = protocols;
        this.topPorts = topPorts;
        this.alertsCount = alertsCount;
        this.networkPacketsCount = networkPacketsCount;
        this.totalLogEntries = totalLogEntries;
        this.alertsByType = alertsByType;
        this.alertsBySeverity = alertsBySeverity;
        this.networkTraffic = networkTraffic;
        this.sources = sources;
    }
    
    public int getWindowSeconds() {
        return windowSeconds;
    }
    
    public List<PerformancePoint> getPerformance() {
        return performance;
    }
    
    public List<ProtocolShare> getProtocols() {
        return protocols;
    }
    
    public List<PortCount> getTopPorts() {
        return topPorts;
    }
    
    public OptionalLong getAlertsCount() {
        return alertsCount;
    }
    
    public OptionalLong getNetworkPacketsCount() {
        return networkPacketsCount;
    }
    
    public OptionalLong getTotalLogEntries() {
        return totalLogEntries;
    }
    
    public Map<String, Long> getAlertsByType() {
        return alertsByType;
    }
    
    public Map<String, Long> getAlertsBySeverity() {
        return alertsBySeverity;
    }
    
    public List<TrafficPoint> getNetworkTraffic() {
        return networkTraffic;
    }
    
    public Map<String, SlotView> getSources() {
        return sources;
    }
}
