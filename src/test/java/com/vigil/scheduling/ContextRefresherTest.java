package com.vigil.scheduling;

import com.vigil.aggregation.SlotState;
import com.vigil.aggregation.SnapshotStore;
import com.vigil.aggregation.TelemetryAggregator;
import com.vigil.domain.SystemStatus;
import com.vigil.source.FetchResult;
import com.vigil.source.SourceKind;
import com.vigil.source.SourceRequest;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for ContextRefresher
 * The interval timer runs on a virtual-time scheduler and the aggregator is
 * mocked, so cycles can be held in flight for as long as a test needs.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ContextRefresher Tests")
class ContextRefresherTest {
    
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final Duration INTERVAL = Duration.ofSeconds(15);
    private static final Map<SourceKind, FetchResult> RESULTS = Map.of(
        SourceKind.STATUS, FetchResult.success(new SystemStatus("running", 1.0, NOW), NOW));
    
    @Mock
    private TelemetryAggregator aggregator;
    
    private VirtualTimeScheduler scheduler;
    private RefreshMetrics metrics;
    private SnapshotStore store;
    private ContextRefresher refresher;
    
    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        metrics = new RefreshMetrics(new SimpleMeterRegistry());
        store = new SnapshotStore();
        refresher = new ContextRefresher(ViewContext.LOGS, aggregator, store, metrics, INTERVAL, 3600, scheduler);
    }
    
    @AfterEach
    void tearDown() {
        refresher.stop();
        scheduler.dispose();
    }
    
    @Test
    @DisplayName("Should refresh immediately on start and then on every interval")
    void shouldRefreshOnInterval() {
        // Given: Cycles that complete at once
        when(aggregator.fetchAll(anyList())).thenReturn(Mono.just(RESULTS));
        
        // When: Started and run for two intervals
        refresher.start();
        scheduler.advanceTime();
        
        // Then: The first cycle ran and was published
        verify(aggregator, times(1)).fetchAll(anyList());
        assertThat(store.current().slot(SourceKind.STATUS).getState()).isEqualTo(SlotState.FRESH);
        assertThat(refresher.getState()).isEqualTo(RefreshState.IDLE);
        
        scheduler.advanceTimeBy(INTERVAL.multipliedBy(2));
        verify(aggregator, times(3)).fetchAll(anyList());
        assertThat(metrics.getCycleCount(ViewContext.LOGS)).isEqualTo(3.0);
    }
    
    @Test
    @DisplayName("Should skip ticks while a cycle is still in flight")
    void shouldSkipOverlappingTicks() {
        // Given: A cycle that does not complete until released
        Sinks.One<Map<SourceKind, FetchResult>> pending = Sinks.one();
        when(aggregator.fetchAll(anyList())).thenReturn(pending.asMono(), Mono.just(RESULTS));
        
        refresher.start();
        scheduler.advanceTime();
        assertThat(refresher.getState()).isEqualTo(RefreshState.FETCHING);
        
        // When: Two more ticks fire while the first cycle is pending
        scheduler.advanceTimeBy(INTERVAL.multipliedBy(2));
        
        // Then: No second cycle was started
        verify(aggregator, times(1)).fetchAll(anyList());
        assertThat(metrics.getSkippedCount(ViewContext.LOGS)).isEqualTo(2.0);
        assertThat(refresher.triggerRefresh()).isFalse();
        
        // When: The first cycle completes
        pending.tryEmitValue(RESULTS);
        assertThat(refresher.getState()).isEqualTo(RefreshState.IDLE);
        
        // Then: The next tick starts a new cycle
        scheduler.advanceTimeBy(INTERVAL);
        verify(aggregator, times(2)).fetchAll(anyList());
    }
    
    @Test
    @DisplayName("Should cancel the timer and discard in-flight results on stop")
    void shouldDiscardResultsAfterStop() {
        Sinks.One<Map<SourceKind, FetchResult>> pending = Sinks.one();
        when(aggregator.fetchAll(anyList())).thenReturn(pending.asMono());
        
        refresher.start();
        scheduler.advanceTime();
        
        // When: Stopped while the cycle is in flight, then the cycle completes
        refresher.stop();
        pending.tryEmitValue(RESULTS);
        
        // Then: Nothing is published and no further ticks fire
        assertThat(store.current().slot(SourceKind.STATUS).getState()).isEqualTo(SlotState.UNPOPULATED);
        assertThat(metrics.getDiscardedCount(ViewContext.LOGS)).isEqualTo(1.0);
        scheduler.advanceTimeBy(INTERVAL.multipliedBy(3));
        verify(aggregator, times(1)).fetchAll(anyList());
        assertThat(refresher.isRunning()).isFalse();
        assertThat(refresher.triggerRefresh()).isFalse();
    }
    
    @Test
    @DisplayName("Should not publish a cycle whose context was stopped while it was starting")
    void shouldNotPublishWhenStoppedDuringStart() {
        // Given: The context is torn down while the cycle is being set up
        when(aggregator.fetchAll(anyList())).thenAnswer(invocation -> {
            refresher.stop();
            return Mono.just(RESULTS);
        });
        
        // When: A refresh is triggered and its results arrive at once
        boolean started = refresher.triggerRefresh();
        
        // Then: The results are dropped and the refresher is idle again
        assertThat(started).isTrue();
        assertThat(store.current().slot(SourceKind.STATUS).getState()).isEqualTo(SlotState.UNPOPULATED);
        assertThat(metrics.getDiscardedCount(ViewContext.LOGS)).isEqualTo(1.0);
        assertThat(refresher.getState()).isEqualTo(RefreshState.IDLE);
        assertThat(refresher.triggerRefresh()).isFalse();
    }
    
    @Test
    @DisplayName("Should refresh on demand without a running timer")
    void shouldRefreshOnDemand() {
        when(aggregator.fetchAll(anyList())).thenReturn(Mono.just(RESULTS));
        
        assertThat(refresher.triggerRefresh()).isTrue();
        
        assertThat(store.current().getStatus()).isPresent();
    }
    
    @Test
    @DisplayName("Should fetch with the new window after a window change")
    @SuppressWarnings("unchecked")
    void shouldApplyNewWindow() {
        when(aggregator.fetchAll(anyList())).thenReturn(Mono.just(RESULTS));
        
        boolean started = refresher.changeWindow(900);
        
        assertThat(started).isTrue();
        assertThat(refresher.getWindowSeconds()).isEqualTo(900);
        ArgumentCaptor<List<SourceRequest>> plan = ArgumentCaptor.forClass(List.class);
        verify(aggregator).fetchAll(plan.capture());
        assertThat(plan.getValue()).contains(SourceRequest.windowed(SourceKind.LOGS, 900));
    }
    
    @Test
    @DisplayName("Should reject a non-positive window")
    void shouldRejectInvalidWindow() {
        assertThatThrownBy(() -> refresher.changeWindow(0))
            .isInstanceOf(IllegalArgumentException.class);
        verify(aggregator, never()).fetchAll(anyList());
        assertThat(refresher.getWindowSeconds()).isEqualTo(3600);
    }
    
    @Test
    @DisplayName("Should ignore a second start")
    void shouldIgnoreSecondStart() {
        when(aggregator.fetchAll(anyList())).thenReturn(Mono.just(RESULTS));
        
        refresher.start();
        refresher.start();
        scheduler.advanceTime();
        
        verify(aggregator, times(1)).fetchAll(anyList());
    }
}
