package com.vigil.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.vigil.aggregation.Slot;
import com.vigil.aggregation.SlotState;
import com.vigil.source.FetchError;

import java.time.Instant;

/**
 * One snapshot slot as exposed to the presentation layer
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SlotView {
    
    @JsonProperty("state")
    private final SlotState state;
    
    @JsonProperty("fetched_at")
    private final Instant fetchedAt;
    
    @JsonProperty("last_error")
    private final FetchError lastError;
    
    @JsonProperty("consecutive_failures")
    private final int consecutiveFailures;
    
    @JsonProperty("payload")
    private final Object payload;
    
    private SlotView(SlotState state, Instant fetchedAt, FetchError lastError,
                     int consecutiveFailures, Object payload) {
        this.state = state;
        this.fetchedAt = fetchedAt;
        this.lastError = lastError;
        this.consecutiveFailures = consecutiveFailures;
        this.payload = payload;
    }
    
    public static SlotView of(Slot slot, boolean includePayload) {
        return new SlotView(
            slot.getState(),
            slot.getFetchedAt().orElse(null),
            slot.getLastError().orElse(null),
            slot.getConsecutiveFailures(),
            includePayload ? slot.getPayload().orElse(null) : null);
    }
    
    public SlotState getState() {
        return state;
    }
    
    public Instant getFetchedAt() {
        return fetchedAt;
    }
    
    public FetchError getLastError() {
        return lastError;
    }
    
    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }
    
    public Object getPayload() {
        return payload;
    }
}
