package com.vigil.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Severity of a log or alert record.
 * The declaration order is the fixed total order used for sorting:
 * critical first, low last.
 */
public enum Severity {
    
    CRITICAL("critical"),
    
    HIGH("high"),
    
    MEDIUM("medium"),
    
    LOW("low");
    
    /**
     * Bucket name used in aggregates for records without a severity
     */
    public static final String UNKNOWN = "unknown";
    
    private final String value;
    
    Severity(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    /**
     * Sort rank, 0 for critical up to 3 for low
     */
    public int getRank() {
        return ordinal();
    }
    
    /**
     * Parse a string value to Severity
     */
    public static Severity fromValue(String value) {
        for (Severity severity : Severity.values()) {
            if (severity.value.equalsIgnoreCase(value)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown Severity value: " + value);
    }
    
    /**
     * Lenient variant of {@link #fromValue(String)}: blank or unrecognized values are absent.
     */
    public static Optional<Severity> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        for (Severity severity : Severity.values()) {
            if (severity.value.equalsIgnoreCase(value.trim())) {
                return Optional.of(severity);
            }
        }
        return Optional.empty();
    }
}
