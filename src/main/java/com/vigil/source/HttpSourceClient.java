package com.vigil.source;

import com.vigil.normalization.DecoderRegistry;
import com.vigil.normalization.PayloadParseException;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * HTTP implementation of SourceClient for the telemetry source API.
 * 
 * Features:
 * - One GET per fetch ({@code <base>/<path>?window=<seconds>} for windowed sources)
 * - Retry with backoff on connection errors, 429 and 5xx
 * - Per-call timeout covering all attempts
 * - Every failure converted to a {@link FetchError} value
 * 
 * The client holds no per-call state; concurrent fetches are independent.
 */
public class HttpSourceClient implements SourceClient {
    
    private static final Logger log = LoggerFactory.getLogger(HttpSourceClient.class);
    
    private final WebClient webClient;
    private final DecoderRegistry decoders;
    private final SourceMetrics metrics;
    private final Clock clock;
    private final Duration callTimeout;
    private final int maxRetries;
    private final Duration retryBackoff;
    
    public HttpSourceClient(WebClient webClient, DecoderRegistry decoders, SourceMetrics metrics,
                            Clock clock, Duration callTimeout, int maxRetries, Duration retryBackoff) {
        this.webClient = webClient;
        this.decoders = decoders;
        this.metrics = metrics;
        this.clock = clock;
        this.callTimeout = callTimeout;
        this.maxRetries = maxRetries;
        this.retryBackoff = retryBackoff;
    }
    
    @Override
    public Mono<FetchResult> fetch(SourceKind kind, Integer windowSeconds) {
        return Mono.defer(() -> {
            metrics.recordFetch(kind);
            Timer.Sample sample = metrics.startTimer();
            Optional<Integer> window = kind.isWindowed() ? Optional.ofNullable(windowSeconds) : Optional.empty();
            
            return webClient.get()
                .uri(builder -> builder
                    .path("/" + kind.getPath())
                    .queryParamIfPresent("window", window)
                    .build())
                .retrieve()
                .bodyToMono(String.class)
                .switchIfEmpty(Mono.error(() -> new PayloadParseException("Empty response body", kind, null)))
                .map(body -> decoders.decode(kind, body))
                .retryWhen(Retry.backoff(maxRetries, retryBackoff)
                    .filter(this::isRetryableError)
                    .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .timeout(callTimeout)
                .map(payload -> FetchResult.success(payload, clock.instant()))
                .onErrorResume(e -> Mono.just(FetchResult.failure(toFetchError(kind, e))))
                .doOnNext(result -> {
                    metrics.recordLatency(kind, sample);
                    if (result.isSuccess()) {
                        log.debug("Fetched {} (window={})", kind.getValue(), window.orElse(null));
                    } else {
                        FetchError error = result.getError().get();
                        metrics.recordFailure(kind, error.getKind());
                        log.warn("Fetch of {} failed: {}", kind.getValue(), error);
                    }
                });
        });
    }
    
    /**
     * Determine if an error is retryable.
     * Retry on connection errors, 429 and 5xx, but not on other 4xx or on payload errors.
     */
    private boolean isRetryableError(Throwable throwable) {
        if (throwable instanceof WebClientResponseException) {
            int status = ((WebClientResponseException) throwable).getStatusCode().value();
            return status == 429 || status >= 500;
        }
        return throwable instanceof WebClientRequestException;
    }
    
    /**
     * Map a transport or decoding failure to its FetchError category
     */
    FetchError toFetchError(SourceKind kind, Throwable throwable) {
        if (throwable instanceof TimeoutException) {
            return new FetchError(FetchErrorKind.TIMEOUT,
                "No response from " + kind.getValue() + " within " + callTimeout.toMillis() + "ms", clock.instant());
        }
        if (throwable instanceof WebClientResponseException) {
            WebClientResponseException ex = (WebClientResponseException) throwable;
            int status = ex.getStatusCode().value();
            FetchErrorKind errorKind = status == 401 || status == 403
                ? FetchErrorKind.UNAUTHORIZED
                : FetchErrorKind.BAD_RESPONSE;
            return new FetchError(errorKind, "HTTP " + status + " from " + kind.getValue(), clock.instant());
        }
        if (throwable instanceof PayloadParseException) {
            return new FetchError(FetchErrorKind.BAD_RESPONSE, throwable.getMessage(), clock.instant());
        }
        if (throwable instanceof WebClientRequestException) {
            Throwable cause = throwable.getCause() != null ? throwable.getCause() : throwable;
            return new FetchError(FetchErrorKind.UNREACHABLE,
                kind.getValue() + " unreachable: " + cause.getMessage(), clock.instant());
        }
        log.error("Unexpected error fetching {}", kind.getValue(), throwable);
        return new FetchError(FetchErrorKind.UNREACHABLE,
            kind.getValue() + " failed: " + throwable.getMessage(), clock.instant());
    }
}
