package com.vigil.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vigil.scheduling.RefreshState;
import com.vigil.scheduling.ViewContext;

import java.util.Map;

/**
 * Every slot of a context's snapshot with its refresh state
 */
public class SnapshotResponse {
    
    @JsonProperty("context")
    private final ViewContext context;
    
    @JsonProperty("refresh_state")
    private final RefreshState refreshState;
    
    @JsonProperty("window_seconds")
    private final int windowSeconds;
    
    @JsonProperty("slots")
    private final Map<String, SlotView> slots;
    
    public SnapshotResponse(ViewContext context, RefreshState refreshState, int windowSeconds,
                            Map<String, SlotView> slots) {
        this.context = context;
        this.refreshState = refreshState;
        this.windowSeconds = windowSeconds;
        this.slots = slots;
    }
    
    public ViewContext getContext() {
        return context;
    }
    
    public RefreshState getRefreshState() {
        return refreshState;
    }
    
    public int getWindowSeconds() {
        return windowSeconds;
    }
    
    public Map<String, SlotView> getSlots() {
        return slots;
    }
}
