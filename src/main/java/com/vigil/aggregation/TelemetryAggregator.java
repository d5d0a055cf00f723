package com.vigil.aggregation;

import com.vigil.source.FetchError;
import com.vigil.source.FetchErrorKind;
import com.vigil.source.FetchResult;
import com.vigil.source.SourceClient;
import com.vigil.source.SourceKind;
import com.vigil.source.SourceRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * TelemetryAggregator runs one refresh cycle: it fans a plan of source
 * requests out to the {@link SourceClient} concurrently and collects one
 * {@link FetchResult} per source.
 * 
 * Each call is bounded on its own, so a slow source delays nobody but itself,
 * and each call is isolated, so a client that throws (synchronously or
 * asynchronously) yields a failed result for its own source only. The cycle
 * therefore always completes with a value.
 */
@Service
public class TelemetryAggregator {
    
    private static final Logger log = LoggerFactory.getLogger(TelemetryAggregator.class);
    
    private final SourceClient client;
    private final Duration callBound;
    private final Scheduler timerScheduler;
    private final Clock clock;
    
    @Autowired
    public TelemetryAggregator(
            SourceClient client,
            @Value("${vigil.source.call-timeout-ms:5000}") long callTimeoutMs,
            Scheduler timerScheduler,
            Clock clock) {
        this(client, Duration.ofMillis(callTimeoutMs), timerScheduler, clock);
    }
    
    public TelemetryAggregator(SourceClient client, Duration callBound, Scheduler timerScheduler, Clock clock) {
        if (callBound.isNegative() || callBound.isZero()) {
            throw new IllegalArgumentException("Call bound must be positive: " + callBound);
        }
        this.client = client;
        this.callBound = callBound;
        this.timerScheduler = timerScheduler;
        this.clock = clock;
    }
    
    /**
     * Fetch every source of the plan concurrently.
     * 
     * @param plan the requests of one cycle, at most one per source kind
     * @return Mono completing with one result per requested source, never with an error
     */
    public Mono<Map<SourceKind, FetchResult>> fetchAll(List<SourceRequest> plan) {
        if (plan.isEmpty()) {
            return Mono.just(new EnumMap<>(SourceKind.class));
        }
        return Flux.fromIterable(plan)
            .flatMap(request -> fetchOne(request)
                .map(result -> Map.entry(request.getKind(), result)), plan.size())
            .collectMap(Map.Entry::getKey, Map.Entry::getValue, () -> new EnumMap<>(SourceKind.class))
            .doOnNext(results -> {
                long failed = results.values().stream().filter(r -> !r.isSuccess()).count();
                if (failed > 0) {
                    log.info("Refresh cycle finished: {} of {} sources failed", failed, results.size());
                } else {
                    log.debug("Refresh cycle finished: {} sources fetched", results.size());
                }
            });
    }
    
    /**
     * One cycle merged into the given snapshot.
     * 
     * @return Mono completing with the new snapshot; the input is unchanged
     */
    public Mono<Snapshot> refresh(Snapshot snapshot, List<SourceRequest> plan) {
        return fetchAll(plan).map(snapshot::merge);
    }
    
    private Mono<FetchResult> fetchOne(SourceRequest request) {
        SourceKind kind = request.getKind();
        return Mono.defer(() -> client.fetch(request))
            .switchIfEmpty(Mono.fromSupplier(() -> FetchResult.failure(
                FetchErrorKind.BAD_RESPONSE, "No result from " + kind.getValue(), clock.instant())))
            .timeout(callBound, timerScheduler)
            .onErrorResume(TimeoutException.class, error -> {
                log.warn("Source {} exceeded its {}ms bound", kind.getValue(), callBound.toMillis());
                return Mono.just(FetchResult.failure(new FetchError(FetchErrorKind.TIMEOUT,
                    "No result within " + callBound.toMillis() + "ms", clock.instant())));
            })
            .onErrorResume(error -> {
                log.error("Source {} failed unexpectedly: {}", kind.getValue(), error.getMessage(), error);
                return Mono.just(FetchResult.failure(new FetchError(FetchErrorKind.UNREACHABLE,
                    String.valueOf(error.getMessage()), clock.instant())));
            });
    }
    
    public Duration getCallBound() {
        return callBound;
    }
}
