package com.vigil.scheduling;

import com.fasterxml.jackson.annotation.JsonValue;
import com.vigil.source.SourceKind;
import com.vigil.source.SourceRequest;

import java.util.List;

/**
 * A view of the dashboard with its own refresh cadence and source plan.
 * Each context keeps its own snapshot.
 */
public enum ViewContext {
    
    OVERVIEW("overview") {
        @Override
        public List<SourceRequest> plan(int windowSeconds) {
            return List.of(
                SourceRequest.latest(SourceKind.STATUS),
                SourceRequest.latest(SourceKind.THREAT_SUMMARY),
                SourceRequest.windowed(SourceKind.METRICS, windowSeconds),
                SourceRequest.windowed(SourceKind.NETWORK, windowSeconds),
                SourceRequest.latest(SourceKind.ALERT_SUMMARY),
                SourceRequest.windowed(SourceKind.LOGS, windowSeconds));
        }
    },
    
    LOGS("logs") {
        @Override
        public List<SourceRequest> plan(int windowSeconds) {
            return List.of(
                SourceRequest.windowed(SourceKind.LOGS, windowSeconds),
                SourceRequest.latest(SourceKind.ALERT_SUMMARY),
                SourceRequest.latest(SourceKind.THREAT_SUMMARY));
        }
    },
    
    ANALYTICS("analytics") {
        @Override
        public List<SourceRequest> plan(int windowSeconds) {
            return List.of(
                SourceRequest.latest(SourceKind.ANALYTICS),
                SourceRequest.latest(SourceKind.ALERTS),
                SourceRequest.windowed(SourceKind.NETWORK, windowSeconds),
                SourceRequest.windowed(SourceKind.METRICS, windowSeconds));
        }
    };
    
    private final String value;
    
    ViewContext(String value) {
        this.value = value;
    }
    
    /**
     * The requests of one refresh cycle, one per source kind
     * 
     * @param windowSeconds window applied to the windowed sources
     */
    public abstract List<SourceRequest> plan(int windowSeconds);
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    public static ViewContext fromValue(String value) {
        for (ViewContext context : ViewContext.values()) {
            if (context.value.equalsIgnoreCase(value)) {
                return context;
            }
        }
        throw new IllegalArgumentException("Unknown view context: " + value);
    }
}
