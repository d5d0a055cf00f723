package com.vigil.aggregation;

import com.vigil.source.FetchError;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Latest known state of one source within a {@link Snapshot}.
 * 
 * The payload and its fetch time change only on a successful fetch. A failed
 * fetch records the error and bumps the consecutive-failure counter, leaving
 * the payload in place. Instances are immutable; every transition returns a new slot.
 */
public final class Slot {
    
    private static final Slot UNPOPULATED = new Slot(null, null, null, 0, 0);
    
    private final Object payload;
    private final Instant fetchedAt;
    private final FetchError lastError;
    private final int consecutiveFailures;
    private final long successCount;
    
    private Slot(Object payload, Instant fetchedAt, FetchError lastError,
                 int consecutiveFailures, long successCount) {
        this.payload = payload;
        this.fetchedAt = fetchedAt;
        this.lastError = lastError;
        this.consecutiveFailures = consecutiveFailures;
        this.successCount = successCount;
    }
    
    public static Slot unpopulated() {
        return UNPOPULATED;
    }
    
    public Slot withSuccess(Object newPayload, Instant newFetchedAt) {
        return new Slot(
            Objects.requireNonNull(newPayload, "payload"),
            Objects.requireNonNull(newFetchedAt, "fetchedAt"),
            null,
            0,
            successCount + 1);
    }
    
    public Slot withFailure(FetchError error) {
        return new Slot(payload, fetchedAt, Objects.requireNonNull(error, "error"),
            consecutiveFailures + 1, successCount);
    }
    
    public boolean isPopulated() {
        return payload != null;
    }
    
    public boolean isStale() {
        return isPopulated() && lastError != null;
    }
    
    public SlotState getState() {
        if (!isPopulated()) {
            return SlotState.UNPOPULATED;
        }
        return lastError != null ? SlotState.STALE : SlotState.FRESH;
    }
    
    public Optional<Object> getPayload() {
        return Optional.ofNullable(payload);
    }
    
    /**
     * The payload if present and of the given type
     */
    public <T> Optional<T> getPayload(Class<T> type) {
        return type.isInstance(payload) ? Optional.of(type.cast(payload)) : Optional.empty();
    }
    
    public Optional<Instant> getFetchedAt() {
        return Optional.ofNullable(fetchedAt);
    }
    
    public Optional<FetchError> getLastError() {
        return Optional.ofNullable(lastError);
    }
    
    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }
    
    public long getSuccessCount() {
        return successCount;
    }
    
    @Override
    public String toString() {
        return "Slot{state=" + getState() + ", fetchedAt=" + fetchedAt
            + ", lastError=" + lastError + ", consecutiveFailures=" + consecutiveFailures + "}";
    }
}
