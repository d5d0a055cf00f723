package com.vigil.scheduling;

import com.vigil.aggregation.SnapshotStore;
import com.vigil.aggregation.TelemetryAggregator;
import com.vigil.source.SourceRequest;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives refresh cycles for one view context on its own interval timer.
 * 
 * At most one cycle per context is in flight: a tick (or an on-demand refresh)
 * arriving while a cycle is still fetching is skipped, not queued. Stopping
 * the refresher cancels its timer at once; fetches already in flight run to
 * completion but their results are dropped instead of published.
 * 
 * The timer runs on an injected {@link Scheduler}, so tests can drive it with
 * virtual time.
 */
public class ContextRefresher {
    
    private static final Logger log = LoggerFactory.getLogger(ContextRefresher.class);
    
    private final ViewContext context;
    private final TelemetryAggregator aggregator;
    private final SnapshotStore store;
    private final RefreshMetrics metrics;
    private final Duration interval;
    private final Scheduler timerScheduler;
    
    private final AtomicReference<RefreshState> state = new AtomicReference<>(RefreshState.IDLE);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicLong generation = new AtomicLong();
    private final AtomicInteger windowSeconds;
    private volatile Disposable timer;
    
    public ContextRefresher(ViewContext context, TelemetryAggregator aggregator, SnapshotStore store,
                            RefreshMetrics metrics, Duration interval, int windowSeconds,
                            Scheduler timerScheduler) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Refresh interval must be positive: " + interval);
        }
        this.context = context;
        this.aggregator = aggregator;
        this.store = store;
        this.metrics = metrics;
        this.interval = interval;
        this.windowSeconds = new AtomicInteger(requirePositive(windowSeconds));
        this.timerScheduler = timerScheduler;
    }
    
    /**
     * Start the interval timer. The first tick fires immediately.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Refresher already running for context: {}", context.getValue());
            return;
        }
        stopped.set(false);
        timer = Flux.interval(Duration.ZERO, interval, timerScheduler)
            .subscribe(tick -> triggerRefresh());
        log.info("Started refresher for context: {} with interval: {}s, window: {}s",
            context.getValue(), interval.getSeconds(), windowSeconds.get());
    }
    
    /**
     * Cancel the timer and tear the context down. Results of a cycle still in
     * flight are discarded when they arrive.
     */
    public void stop() {
        stopped.set(true);
        generation.incrementAndGet();
        if (!running.getAndSet(false)) {
            return;
        }
        Disposable current = timer;
        if (current != null) {
            current.dispose();
        }
        log.info("Stopped refresher for context: {}", context.getValue());
    }
    
    /**
     * Run one refresh cycle unless one is already in flight.
     * 
     * @return true if a cycle was started, false if it was skipped
     */
    public boolean triggerRefresh() {
        // Read before the stopped check: a stop() landing after it bumps the generation
        long cycleGeneration = generation.get();
        if (stopped.get()) {
            log.debug("Ignoring refresh for stopped context: {}", context.getValue());
            return false;
        }
        if (!state.compareAndSet(RefreshState.IDLE, RefreshState.FETCHING)) {
            log.debug("Skipping refresh of {}: previous cycle still in flight", context.getValue());
            metrics.recordSkippedTick(context);
            return false;
        }
        
        List<SourceRequest> plan = context.plan(windowSeconds.get());
        Timer.Sample sample = metrics.startCycle();
        metrics.recordCycleStarted(context);
        
        aggregator.fetchAll(plan)
            .doFinally(signal -> {
                metrics.recordCycleDuration(context, sample);
                state.set(RefreshState.IDLE);
            })
            .subscribe(
                results -> {
                    if (generation.get() == cycleGeneration && !stopped.get()) {
                        store.publish(results);
                    } else {
                        log.debug("Discarding results of {} cycle after teardown", context.getValue());
                        metrics.recordDiscarded(context);
                    }
                },
                error -> log.error("Refresh cycle for {} failed", context.getValue(), error));
        return true;
    }
    
    /**
     * Change the query window and refresh with it.
     * 
     * @return true if a refresh was started; otherwise the next tick uses the new window
     */
    public boolean changeWindow(int seconds) {
        int previous = windowSeconds.getAndSet(requirePositive(seconds));
        log.info("Window of {} changed from {}s to {}s", context.getValue(), previous, seconds);
        return triggerRefresh();
    }
    
    public ViewContext getContext() {
        return context;
    }
    
    public SnapshotStore getStore() {
        return store;
    }
    
    public RefreshState getState() {
        return state.get();
    }
    
    public int getWindowSeconds() {
        return windowSeconds.get();
    }
    
    public Duration getInterval() {
        return interval;
    }
    
    public boolean isRunning() {
        return running.get();
    }
    
    private static int requirePositive(int seconds) {
        if (seconds <= 0) {
            throw new IllegalArgumentException("Window must be positive: " + seconds);
        }
        return seconds;
    }
}
