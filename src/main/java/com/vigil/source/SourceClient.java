package com.vigil.source;

import reactor.core.publisher.Mono;

/**
 * SourceClient defines the accessor for the external telemetry sources.
 * 
 * Implementations must be safe to call concurrently and must not share
 * mutable state between calls. Failures are reported as a failed
 * {@link FetchResult}, never as an error signal: callers always receive a value.
 */
public interface SourceClient {
    
    /**
     * Query one source.
     * 
     * @param kind the source to query
     * @param windowSeconds records from now-window to now; null asks for the latest state only
     * @return Mono completing with the decoded payload or the typed failure
     */
    Mono<FetchResult> fetch(SourceKind kind, Integer windowSeconds);
    
    /**
     * Convenience overload for a prepared request
     */
    default Mono<FetchResult> fetch(SourceRequest request) {
        return fetch(request.getKind(), request.getWindowSeconds().orElse(null));
    }
}
