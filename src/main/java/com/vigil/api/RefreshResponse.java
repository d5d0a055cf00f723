package com.vigil.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vigil.scheduling.ViewContext;

/**
 * Outcome of an on-demand refresh or window change
 */
public class RefreshResponse {
    
    @JsonProperty("context")
    private final ViewContext context;
    
    /**
     * False when the request was skipped because a cycle was already in flight
     */
    @JsonProperty("started")
    private final boolean started;
    
    @JsonProperty("window_seconds")
    private final int windowSeconds;
    
    public RefreshResponse(ViewContext context, boolean started, int windowSeconds) {
        this.context = context;
        this.started = started;
        this.windowSeconds = windowSeconds;
    }
    
    public ViewContext getContext() {
        return context;
    }
    
    public boolean isStarted() {
        return started;
    }
    
    public int getWindowSeconds() {
        return windowSeconds;
    }
}
