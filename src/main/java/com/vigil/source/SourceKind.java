package com.vigil.source;

import com.fasterxml.jackson.annotation.JsonValue;
import com.vigil.domain.AnalyticsBundle;
import com.vigil.domain.AlertSummary;
import com.vigil.domain.SystemStatus;
import com.vigil.domain.ThreatSummary;

import java.util.List;

/**
 * The telemetry sources the engine polls. Each kind maps to one endpoint of
 * the source API and to one slot of a snapshot.
 */
public enum SourceKind {
    
    STATUS("status", "status", false, SystemStatus.class),
    
    THREAT_SUMMARY("threat_summary", "threats/summary", false, ThreatSummary.class),
    
    /**
     * List of MetricSample, ascending by timestamp
     */
    METRICS("metrics", "metrics", true, List.class),
    
    /**
     * List of NetworkSample, ascending by timestamp
     */
    NETWORK("network", "network", true, List.class),
    
    ALERT_SUMMARY("alert_summary", "alerts/summary", false, AlertSummary.class),
    
    /**
     * List of AlertRecord
     */
    ALERTS("alerts", "alerts", false, List.class),
    
    /**
     * List of classified LogRecord
     */
    LOGS("logs", "logs", true, List.class),
    
    ANALYTICS("analytics", "analytics", false, AnalyticsBundle.class);
    
    private final String value;
    private final String path;
    private final boolean windowed;
    private final Class<?> payloadType;
    
    SourceKind(String value, String path, boolean windowed, Class<?> payloadType) {
        this.value = value;
        this.path = path;
        this.windowed = windowed;
        this.payloadType = payloadType;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    /**
     * Endpoint path relative to the source base URL
     */
    public String getPath() {
        return path;
    }
    
    /**
     * Whether the endpoint accepts a {@code window} query parameter
     */
    public boolean isWindowed() {
        return windowed;
    }
    
    public Class<?> getPayloadType() {
        return payloadType;
    }
    
    public static SourceKind fromValue(String value) {
        for (SourceKind kind : SourceKind.values()) {
            if (kind.value.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown SourceKind value: " + value);
    }
}
