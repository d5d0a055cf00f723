package com.vigil.source;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one source fetch: either a decoded payload with the instant it was
 * fetched, or a {@link FetchError}. Exactly one side is present.
 */
public final class FetchResult {
    
    private final Object payload;
    private final Instant fetchedAt;
    private final FetchError error;
    
    private FetchResult(Object payload, Instant fetchedAt, FetchError error) {
        this.payload = payload;
        this.fetchedAt = fetchedAt;
        this.error = error;
    }
    
    public static FetchResult success(Object payload, Instant fetchedAt) {
        return new FetchResult(
            Objects.requireNonNull(payload, "payload"),
            Objects.requireNonNull(fetchedAt, "fetchedAt"),
            null);
    }
    
    public static FetchResult failure(FetchError error) {
        return new FetchResult(null, null, Objects.requireNonNull(error, "error"));
    }
    
    public static FetchResult failure(FetchErrorKind kind, String detail, Instant occurredAt) {
        return failure(new FetchError(kind, detail, occurredAt));
    }
    
    public boolean isSuccess() {
        return error == null;
    }
    
    public Optional<Object> getPayload() {
        return Optional.ofNullable(payload);
    }
    
    public Optional<Instant> getFetchedAt() {
        return Optional.ofNullable(fetchedAt);
    }
    
    public Optional<FetchError> getError() {
        return Optional.ofNullable(error);
    }
    
    @Override
    public String toString() {
        return isSuccess() ? "FetchResult{success at " + fetchedAt + "}" : "FetchResult{" + error + "}";
    }
}
