package com.vigil.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Current state of the monitored IDS host as reported by the status source.
 */
public final class SystemStatus {
    
    private final String status;
    private final Double uptimeSeconds;
    private final Instant lastUpdate;
    
    public SystemStatus(String status, Double uptimeSeconds, Instant lastUpdate) {
        this.status = Objects.requireNonNull(status, "status");
        this.uptimeSeconds = uptimeSeconds;
        this.lastUpdate = lastUpdate;
    }
    
    @JsonProperty("status")
    public String getStatus() {
        return status;
    }
    
    @JsonProperty("uptime")
    public OptionalDouble getUptimeSeconds() {
        return uptimeSeconds != null ? OptionalDouble.of(uptimeSeconds) : OptionalDouble.empty();
    }
    
    @JsonProperty("last_update")
    public Optional<Instant> getLastUpdate() {
        return Optional.ofNullable(lastUpdate);
    }
}
