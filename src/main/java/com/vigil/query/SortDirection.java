package com.vigil.query;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SortDirection {
    
    ASC("asc"),
    
    DESC("desc");
    
    private final String value;
    
    SortDirection(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    public static SortDirection fromValue(String value) {
        for (SortDirection direction : SortDirection.values()) {
            if (direction.value.equalsIgnoreCase(value)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown sort direction: " + value);
    }
}
