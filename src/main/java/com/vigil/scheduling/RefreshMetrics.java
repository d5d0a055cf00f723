package com.vigil.scheduling;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Metrics collector for refresh cycles.
 * 
 * Tracks per view context:
 * - Cycles started
 * - Ticks skipped because a cycle was still in flight
 * - Cycle results discarded after the context was stopped
 * - Cycle duration
 */
@Component
public class RefreshMetrics {
    
    private final MeterRegistry registry;
    private final Map<ViewContext, Counter> cycles = new ConcurrentHashMap<>();
    private final Map<ViewContext, Counter> skipped = new ConcurrentHashMap<>();
    private final Map<ViewContext, Counter> discarded = new ConcurrentHashMap<>();
    private final Map<ViewContext, Timer> cycleDuration = new ConcurrentHashMap<>();
    
    public RefreshMetrics(MeterRegistry registry) {
        this.registry = registry;
    }
    
    public void recordCycleStarted(ViewContext context) {
        counter(cycles, context, "vigil.refresh.cycles", "Refresh cycles started").increment();
    }
    
    public void recordSkippedTick(ViewContext context) {
        counter(skipped, context, "vigil.refresh.skipped", "Refresh ticks skipped while a cycle was in flight").increment();
    }
    
    public void recordDiscarded(ViewContext context) {
        counter(discarded, context, "vigil.refresh.discarded", "Cycle results discarded after teardown").increment();
    }
    
    public Timer.Sample startCycle() {
        return Timer.start(registry);
    }
    
    public void recordCycleDuration(ViewContext context, Timer.Sample sample) {
        sample.stop(cycleDuration.computeIfAbsent(context, c ->
            Timer.builder("vigil.refresh.duration")
                .description("Duration of refresh cycles")
                .tag("context", c.getValue())
                .register(registry)));
    }
    
    public double getCycleCount(ViewContext context) {
        return count(cycles, context);
    }
    
    public double getSkippedCount(ViewContext context) {
        return count(skipped, context);
    }
    
    public double getDiscardedCount(ViewContext context) {
        return count(discarded, context);
    }
    
    private Counter counter(Map<ViewContext, Counter> counters, ViewContext context,
                            String name, String description) {
        return counters.computeIfAbsent(context, c ->
            Counter.builder(name)
                .description(description)
                .tag("context", c.getValue())
                .register(registry));
    }
    
    private static double count(Map<ViewContext, Counter> counters, ViewContext context) {
        Counter counter = counters.get(context);
        return counter != null ? counter.count() : 0.0;
    }
}
