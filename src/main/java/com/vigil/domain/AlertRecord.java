package com.vigil.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * An individual alert from the alerts source.
 * Type and severity are kept as reported; alert sources use free-form labels.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class AlertRecord {
    
    private final Instant timestamp;
    private final String type;
    private final String severity;
    private final String message;
    private final Map<String, Object> attributes;
    
    public AlertRecord(Instant timestamp, String type, String severity, String message,
                       Map<String, Object> attributes) {
        this.timestamp = timestamp;
        this.type = type == null || type.isBlank() ? null : type;
        this.severity = severity == null || severity.isBlank() ? null : severity;
        this.message = message;
        this.attributes = attributes == null || attributes.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }
    
    @JsonProperty("timestamp")
    public Optional<Instant> getTimestamp() {
        return Optional.ofNullable(timestamp);
    }
    
    @JsonProperty("type")
    public Optional<String> getType() {
        return Optional.ofNullable(type);
    }
    
    @JsonProperty("severity")
    public Optional<String> getSeverity() {
        return Optional.ofNullable(severity);
    }
    
    @JsonProperty("message")
    public Optional<String> getMessage() {
        return Optional.ofNullable(message);
    }
    
    @JsonProperty("attributes")
    public Map<String, Object> getAttributes() {
        return attributes;
    }
}
