package com.vigil.aggregation;

import com.vigil.domain.SystemStatus;
import com.vigil.source.FetchErrorKind;
import com.vigil.source.FetchResult;
import com.vigil.source.SourceClient;
import com.vigil.source.SourceKind;
import com.vigil.source.SourceRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for TelemetryAggregator
 * Sources are faked with delays on a virtual-time scheduler, so the
 * timing assertions are exact and the tests do not sleep.
 */
@DisplayName("TelemetryAggregator Tests")
class TelemetryAggregatorTest {
    
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final SystemStatus RUNNING = new SystemStatus("running", 1.0, NOW);
    
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private VirtualTimeScheduler scheduler;
    
    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
    }
    
    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }
    
    private Mono<FetchResult> after(Duration delay, Object payload) {
        return Mono.delay(delay, scheduler).map(tick -> FetchResult.success(payload, NOW));
    }
    
    private TelemetryAggregator aggregator(SourceClient client, Duration bound) {
        return new TelemetryAggregator(client, bound, scheduler, clock);
    }
    
    @Test
    @DisplayName("Should finish at the call bound when one source is slower than its bound")
    void shouldNotWaitForSlowSource() {
        // Given: Three sources and a 1s bound, where logs would take 2s
        SourceClient client = (kind, window) -> {
            switch (kind) {
                case STATUS:
                    return after(Duration.ofMillis(100), RUNNING);
                case METRICS:
                    return after(Duration.ofMillis(400), List.of());
                default:
                    return after(Duration.ofSeconds(2), List.of());
            }
        };
        TelemetryAggregator aggregator = aggregator(client, Duration.ofSeconds(1));
        List<SourceRequest> plan = List.of(
            SourceRequest.latest(SourceKind.STATUS),
            SourceRequest.windowed(SourceKind.METRICS, 3600),
            SourceRequest.windowed(SourceKind.LOGS, 3600));
        
        // When/Then: The cycle completes at 1s with logs timed out and the others fetched
        StepVerifier.withVirtualTime(() -> aggregator.fetchAll(plan), () -> scheduler, Long.MAX_VALUE)
            .expectSubscription()
            .expectNoEvent(Duration.ofMillis(999))
            .thenAwait(Duration.ofMillis(1))
            .assertNext(results -> {
                assertThat(results).containsOnlyKeys(SourceKind.STATUS, SourceKind.METRICS, SourceKind.LOGS);
                assertThat(results.get(SourceKind.STATUS).isSuccess()).isTrue();
                assertThat(results.get(SourceKind.METRICS).isSuccess()).isTrue();
                assertThat(results.get(SourceKind.LOGS).getError().get().getKind()).isEqualTo(FetchErrorKind.TIMEOUT);
            })
            .verifyComplete();
    }
    
    @Test
    @DisplayName("Should run source calls concurrently")
    void shouldRunConcurrently() {
        SourceClient client = (kind, window) -> after(Duration.ofMillis(600), RUNNING);
        TelemetryAggregator aggregator = aggregator(client, Duration.ofSeconds(1));
        List<SourceRequest> plan = List.of(
            SourceRequest.latest(SourceKind.STATUS),
            SourceRequest.latest(SourceKind.THREAT_SUMMARY),
            SourceRequest.latest(SourceKind.ALERT_SUMMARY));
        
        // Three 600ms calls finish together at 600ms, not one after another
        StepVerifier.withVirtualTime(() -> aggregator.fetchAll(plan), () -> scheduler, Long.MAX_VALUE)
            .expectSubscription()
            .expectNoEvent(Duration.ofMillis(599))
            .thenAwait(Duration.ofMillis(1))
            .assertNext(results -> assertThat(results).hasSize(3))
            .verifyComplete();
    }
    
    @Test
    @DisplayName("Should isolate a client that throws synchronously")
    void shouldIsolateSynchronousThrow() {
        SourceClient client = (kind, window) -> {
            if (kind == SourceKind.NETWORK) {
                throw new IllegalStateException("boom");
            }
            return Mono.just(FetchResult.success(RUNNING, NOW));
        };
        TelemetryAggregator aggregator = aggregator(client, Duration.ofSeconds(1));
        
        StepVerifier.create(aggregator.fetchAll(List.of(
                SourceRequest.latest(SourceKind.STATUS),
                SourceRequest.windowed(SourceKind.NETWORK, 900))))
            .assertNext(results -> {
                assertThat(results.get(SourceKind.STATUS).isSuccess()).isTrue();
                assertThat(results.get(SourceKind.NETWORK).getError().get().getKind())
                    .isEqualTo(FetchErrorKind.UNREACHABLE);
                assertThat(results.get(SourceKind.NETWORK).getError().get().getDetail()).isEqualTo("boom");
            })
            .verifyComplete();
    }
    
    @Test
    @DisplayName("Should isolate error signals and empty completions")
    void shouldIsolateErrorSignals() {
        SourceClient client = (kind, window) -> {
            if (kind == SourceKind.STATUS) {
                return Mono.error(new RuntimeException("lost"));
            }
            return Mono.empty();
        };
        TelemetryAggregator aggregator = aggregator(client, Duration.ofSeconds(1));
        
        StepVerifier.create(aggregator.fetchAll(List.of(
                SourceRequest.latest(SourceKind.STATUS),
                SourceRequest.latest(SourceKind.ANALYTICS))))
            .assertNext(results -> {
                assertThat(results.get(SourceKind.STATUS).getError().get().getKind())
                    .isEqualTo(FetchErrorKind.UNREACHABLE);
                assertThat(results.get(SourceKind.ANALYTICS).getError().get().getKind())
                    .isEqualTo(FetchErrorKind.BAD_RESPONSE);
            })
            .verifyComplete();
    }
    
    @Test
    @DisplayName("Should pass the window of windowed requests to the client")
    void shouldPassWindow() {
        SourceClient client = (kind, window) -> Mono.just(FetchResult.success(
            List.of(String.valueOf(window)), NOW));
        TelemetryAggregator aggregator = aggregator(client, Duration.ofSeconds(1));
        
        StepVerifier.create(aggregator.fetchAll(List.of(SourceRequest.windowed(SourceKind.LOGS, 3600))))
            .assertNext(results -> assertThat(results.get(SourceKind.LOGS).getPayload()).contains(List.of("3600")))
            .verifyComplete();
    }
    
    @Test
    @DisplayName("Should merge a cycle into the given snapshot")
    void shouldRefreshSnapshot() {
        SourceClient client = (kind, window) -> kind == SourceKind.STATUS
            ? Mono.just(FetchResult.success(RUNNING, NOW))
            : Mono.just(FetchResult.failure(FetchErrorKind.UNAUTHORIZED, "401", NOW));
        TelemetryAggregator aggregator = aggregator(client, Duration.ofSeconds(1));
        
        StepVerifier.create(aggregator.refresh(Snapshot.empty(), List.of(
                SourceRequest.latest(SourceKind.STATUS),
                SourceRequest.latest(SourceKind.THREAT_SUMMARY))))
            .assertNext(snapshot -> {
                assertThat(snapshot.getStatus()).contains(RUNNING);
                assertThat(snapshot.slot(SourceKind.THREAT_SUMMARY).getState()).isEqualTo(SlotState.UNPOPULATED);
                assertThat(snapshot.slot(SourceKind.THREAT_SUMMARY).getConsecutiveFailures()).isEqualTo(1);
            })
            .verifyComplete();
    }
    
    @Test
    @DisplayName("Should complete immediately with no results for an empty plan")
    void shouldHandleEmptyPlan() {
        SourceClient client = (kind, window) -> Mono.never();
        
        StepVerifier.create(aggregator(client, Duration.ofSeconds(1)).fetchAll(List.of()))
            .assertNext(results -> assertThat(results).isEmpty())
            .verifyComplete();
    }
    
    @Test
    @DisplayName("Should reject a non-positive call bound")
    void shouldRejectNonPositiveBound() {
        SourceClient client = (kind, window) -> Mono.never();
        
        assertThatThrownBy(() -> aggregator(client, Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
    }
    
    @Test
    @DisplayName("Should publish merged snapshots through the store")
    void shouldPublishThroughStore() {
        SnapshotStore store = new SnapshotStore();
        Snapshot initial = store.current();
        
        Snapshot published = store.publish(Map.of(SourceKind.STATUS, FetchResult.success(RUNNING, NOW)));
        
        assertThat(store.current()).isSameAs(published);
        assertThat(initial.getStatus()).isEmpty();
        assertThat(published.getStatus()).contains(RUNNING);
    }
}
