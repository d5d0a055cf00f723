package com.vigil.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Number of alerts observed for one threat type.
 */
public final class ThreatCount {
    
    private final String type;
    private final long count;
    
    public ThreatCount(String type, long count) {
        this.type = Objects.requireNonNull(type, "type");
        this.count = count;
    }
    
    @JsonProperty("type")
    public String getType() {
        return type;
    }
    
    @JsonProperty("count")
    public long getCount() {
        return count;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ThreatCount)) {
            return false;
        }
        ThreatCount other = (ThreatCount) o;
        return count == other.count && type.equals(other.type);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(type, count);
    }
    
    @Override
    public String toString() {
        return type + "=" + count;
    }
}
