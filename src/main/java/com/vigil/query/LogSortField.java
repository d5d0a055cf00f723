package com.vigil.query;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Sort keys of the log view
 */
public enum LogSortField {
    
    TIMESTAMP("timestamp"),
    
    SOURCE("source"),
    
    SEVERITY("severity");
    
    private final String value;
    
    LogSortField(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    public static LogSortField fromValue(String value) {
        for (LogSortField field : LogSortField.values()) {
            if (field.value.equalsIgnoreCase(value)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Unknown sort field: " + value);
    }
}
