package com.vigil.source;

import java.util.Objects;
import java.util.Optional;

/**
 * One source call of a refresh cycle: which source, and the query window in seconds.
 * An absent window asks for the current/latest state only.
 */
public final class SourceRequest {
    
    private final SourceKind kind;
    private final Integer windowSeconds;
    
    private SourceRequest(SourceKind kind, Integer windowSeconds) {
        this.kind = Objects.requireNonNull(kind, "kind");
        if (windowSeconds != null && windowSeconds <= 0) {
            throw new IllegalArgumentException("window must be positive: " + windowSeconds);
        }
        this.windowSeconds = windowSeconds;
    }
    
    public static SourceRequest latest(SourceKind kind) {
        return new SourceRequest(kind, null);
    }
    
    public static SourceRequest windowed(SourceKind kind, int windowSeconds) {
        if (!kind.isWindowed()) {
            throw new IllegalArgumentException("Source " + kind.getValue() + " does not accept a window");
        }
        return new SourceRequest(kind, windowSeconds);
    }
    
    public SourceKind getKind() {
        return kind;
    }
    
    public Optional<Integer> getWindowSeconds() {
        return Optional.ofNullable(windowSeconds);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SourceRequest)) {
            return false;
        }
        SourceRequest other = (SourceRequest) o;
        return kind == other.kind && Objects.equals(windowSeconds, other.windowSeconds);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(kind, windowSeconds);
    }
    
    @Override
    public String toString() {
        return windowSeconds != null ? kind.getValue() + "?window=" + windowSeconds : kind.getValue();
    }
}
