package com.vigil.aggregation;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What a presentation layer can tell about one snapshot slot.
 */
public enum SlotState {
    
    /**
     * No fetch of this source has ever succeeded
     */
    UNPOPULATED("unpopulated"),
    
    /**
     * The most recent fetch succeeded
     */
    FRESH("fresh"),
    
    /**
     * Holds a payload from an earlier success, but the most recent fetch failed
     */
    STALE("stale");
    
    private final String value;
    
    SlotState(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
}
