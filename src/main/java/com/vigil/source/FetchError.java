package com.vigil.source;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * A failed fetch, described as a value rather than thrown.
 */
public final class FetchError {
    
    private final FetchErrorKind kind;
    private final String detail;
    private final Instant occurredAt;
    
    public FetchError(FetchErrorKind kind, String detail, Instant occurredAt) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.detail = detail != null ? detail : "";
        this.occurredAt = Objects.requireNonNull(occurredAt, "occurredAt");
    }
    
    @JsonProperty("kind")
    public FetchErrorKind getKind() {
        return kind;
    }
    
    @JsonProperty("detail")
    public String getDetail() {
        return detail;
    }
    
    @JsonProperty("occurred_at")
    public Instant getOccurredAt() {
        return occurredAt;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FetchError)) {
            return false;
        }
        FetchError other = (FetchError) o;
        return kind == other.kind && detail.equals(other.detail) && occurredAt.equals(other.occurredAt);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(kind, detail, occurredAt);
    }
    
    @Override
    public String toString() {
        return kind + ": " + detail;
    }
}
