package com.vigil.scheduling;

import com.vigil.aggregation.Snapshot;
import com.vigil.aggregation.SnapshotStore;
import com.vigil.aggregation.TelemetryAggregator;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Owns one {@link ContextRefresher} and snapshot per view context and ties
 * their timers to the application lifecycle.
 */
@Component
public class RefreshCoordinator {
    
    private static final Logger log = LoggerFactory.getLogger(RefreshCoordinator.class);
    
    private final Map<ViewContext, ContextRefresher> refreshers;
    private final boolean enabled;
    
    public RefreshCoordinator(
            TelemetryAggregator aggregator,
            RefreshMetrics metrics,
            Scheduler refreshScheduler,
            @Value("${vigil.scheduler.enabled:true}") boolean enabled,
            @Value("${vigil.scheduler.overview-interval-sec:60}") long overviewIntervalSec,
            @Value("${vigil.scheduler.logs-interval-sec:15}") long logsIntervalSec,
            @Value("${vigil.scheduler.analytics-interval-sec:60}") long analyticsIntervalSec,
            @Value("${vigil.view.overview-window-sec:900}") int overviewWindowSec,
            @Value("${vigil.view.logs-window-sec:3600}") int logsWindowSec,
            @Value("${vigil.view.analytics-window-sec:86400}") int analyticsWindowSec) {
        this.enabled = enabled;
        EnumMap<ViewContext, ContextRefresher> byContext = new EnumMap<>(ViewContext.class);
        byContext.put(ViewContext.OVERVIEW, new ContextRefresher(ViewContext.OVERVIEW, aggregator,
            new SnapshotStore(), metrics, Duration.ofSeconds(overviewIntervalSec), overviewWindowSec, refreshScheduler));
        byContext.put(ViewContext.LOGS, new ContextRefresher(ViewContext.LOGS, aggregator,
            new SnapshotStore(), metrics, Duration.ofSeconds(logsIntervalSec), logsWindowSec, refreshScheduler));
        byContext.put(ViewContext.ANALYTICS, new ContextRefresher(ViewContext.ANALYTICS, aggregator,
            new SnapshotStore(), metrics, Duration.ofSeconds(analyticsIntervalSec), analyticsWindowSec, refreshScheduler));
        this.refreshers = Collections.unmodifiableMap(byContext);
    }
    
    @PostConstruct
    public void start() {
        if (!enabled) {
            log.info("Scheduled refresh disabled; contexts refresh on demand only");
            return;
        }
        refreshers.values().forEach(ContextRefresher::start);
    }
    
    @PreDestroy
    public void stop() {
        refreshers.values().forEach(ContextRefresher::stop);
    }
    
    public ContextRefresher refresher(ViewContext context) {
        return refreshers.get(context);
    }
    
    public Snapshot snapshot(ViewContext context) {
        return store(context).current();
    }
    
    public SnapshotStore store(ViewContext context) {
        return refresher(context).getStore();
    }
    
    public boolean refresh(ViewContext context) {
        return refresher(context).triggerRefresh();
    }
    
    public boolean changeWindow(ViewContext context, int seconds) {
        return refresher(context).changeWindow(seconds);
    }
}
