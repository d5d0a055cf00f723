package com.vigil.source;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Metrics collector for source fetches.
 * 
 * Tracks:
 * - Fetch calls per source
 * - Fetch failures per source and failure kind
 * - Fetch latency per source
 * 
 * These metrics are exposed via Micrometer and can be scraped by Prometheus.
 */
@Component
public class SourceMetrics {
    
    private final MeterRegistry registry;
    private final Map<SourceKind, Counter> fetchCalls = new ConcurrentHashMap<>();
    private final Map<String, Counter> fetchFailures = new ConcurrentHashMap<>();
    private final Map<SourceKind, Timer> fetchLatency = new ConcurrentHashMap<>();
    
    public SourceMetrics(MeterRegistry registry) {
        this.registry = registry;
    }
    
    /**
     * Record a fetch call to a source.
     */
    public void recordFetch(SourceKind kind) {
        fetchCalls.computeIfAbsent(kind, k ->
            Counter.builder("vigil.source.fetch.calls")
                .description("Number of fetch calls made to a telemetry source")
                .tag("source", k.getValue())
                .register(registry)
        ).increment();
    }
    
    /**
     * Record a failed fetch.
     */
    public void recordFailure(SourceKind kind, FetchErrorKind errorKind) {
        fetchFailures.computeIfAbsent(kind.getValue() + ":" + errorKind.getValue(), key ->
            Counter.builder("vigil.source.fetch.failures")
                .description("Number of failed fetches by source and failure kind")
                .tag("source", kind.getValue())
                .tag("error", errorKind.getValue())
                .register(registry)
        ).increment();
    }
    
    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }
    
    /**
     * Record the latency of one fetch, successful or not.
     */
    public void recordLatency(SourceKind kind, Timer.Sample sample) {
        sample.stop(fetchLatency.computeIfAbsent(kind, k ->
            Timer.builder("vigil.source.fetch.latency")
                .description("Latency of telemetry source fetches")
                .tag("source", k.getValue())
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)));
    }
    
    public double getFetchCount(SourceKind kind) {
        Counter counter = fetchCalls.get(kind);
        return counter != null ? counter.count() : 0.0;
    }
    
    public double getFailureCount(SourceKind kind, FetchErrorKind errorKind) {
        Counter counter = fetchFailures.get(kind.getValue() + ":" + errorKind.getValue());
        return counter != null ? counter.count() : 0.0;
    }
}
