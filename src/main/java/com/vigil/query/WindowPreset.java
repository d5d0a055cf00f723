package com.vigil.query;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Query window presets offered to the analytics view
 */
public enum WindowPreset {
    
    LAST_HOUR("hour", 3600),
    
    LAST_6_HOURS("6h", 21600),
    
    LAST_DAY("day", 86400),
    
    LAST_WEEK("week", 604800);
    
    private final String value;
    private final int seconds;
    
    WindowPreset(String value, int seconds) {
        this.value = value;
        this.seconds = seconds;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    public int getSeconds() {
        return seconds;
    }
    
    public static WindowPreset fromValue(String value) {
        for (WindowPreset preset : WindowPreset.values()) {
            if (preset.value.equalsIgnoreCase(value)) {
                return preset;
            }
        }
        throw new IllegalArgumentException("Unknown window preset: " + value);
    }
}
