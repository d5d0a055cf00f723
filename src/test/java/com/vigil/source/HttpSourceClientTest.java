package com.vigil.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vigil.domain.MetricSample;
import com.vigil.domain.SystemStatus;
import com.vigil.normalization.DecoderRegistry;
import com.vigil.normalization.LogClassifier;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.ConnectException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for HttpSourceClient
 * HTTP is faked with an ExchangeFunction, so no network is involved.
 */
@DisplayName("HttpSourceClient Tests")
class HttpSourceClientTest {
    
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final String BASE_URL = "http://source.test/api";
    
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();
    private DecoderRegistry decoders;
    private SourceMetrics metrics;
    
    @BeforeEach
    void setUp() {
        decoders = DecoderRegistry.withDefaults(new LogClassifier(), new ObjectMapper());
        metrics = new SourceMetrics(new SimpleMeterRegistry());
    }
    
    private HttpSourceClient client(ExchangeFunction exchange, int maxRetries) {
        ExchangeFunction recording = request -> {
            requests.add(request);
            return exchange.exchange(request);
        };
        WebClient webClient = WebClient.builder()
            .baseUrl(BASE_URL)
            .exchangeFunction(recording)
            .build();
        return new HttpSourceClient(webClient, decoders, metrics, clock,
            Duration.ofMillis(300), maxRetries, Duration.ofMillis(1));
    }
    
    private static Mono<ClientResponse> json(HttpStatus status, String body) {
        return Mono.just(ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build());
    }
    
    @Test
    @DisplayName("Should decode a successful response and stamp the fetch time")
    void shouldDecodeSuccessfulResponse() {
        HttpSourceClient client = client(request -> json(HttpStatus.OK,
            "{\"status\": \"running\", \"uptime\": 12.0}"), 0);
        
        StepVerifier.create(client.fetch(SourceKind.STATUS, null))
            .assertNext(result -> {
                assertThat(result.isSuccess()).isTrue();
                assertThat(result.getFetchedAt()).contains(NOW);
                assertThat(result.getPayload()).containsInstanceOf(SystemStatus.class);
            })
            .verifyComplete();
        
        assertThat(requests).singleElement()
            .satisfies(request -> assertThat(request.url()).isEqualTo(URI.create(BASE_URL + "/status")));
        assertThat(metrics.getFetchCount(SourceKind.STATUS)).isEqualTo(1.0);
    }
    
    @Test
    @DisplayName("Should pass the window as a query parameter for windowed sources")
    void shouldPassWindow() {
        HttpSourceClient client = client(request -> json(HttpStatus.OK,
            "[{\"timestamp\": 1714557600, \"cpu_percent\": 5}]"), 0);
        
        StepVerifier.create(client.fetch(SourceKind.METRICS, 3600))
            .assertNext(result -> assertThat(result.getPayload().get()).asList()
                .singleElement().isInstanceOf(MetricSample.class))
            .verifyComplete();
        
        assertThat(requests.get(0).url().toString()).isEqualTo(BASE_URL + "/metrics?window=3600");
    }
    
    @Test
    @DisplayName("Should not send a window to sources that only report latest state")
    void shouldIgnoreWindowForLatestSources() {
        HttpSourceClient client = client(request -> json(HttpStatus.OK,
            "{\"total_alerts\": 0}"), 0);
        
        StepVerifier.create(client.fetch(SourceKind.ALERT_SUMMARY, 900))
            .assertNext(result -> assertThat(result.isSuccess()).isTrue())
            .verifyComplete();
        
        assertThat(requests.get(0).url().toString()).isEqualTo(BASE_URL + "/alerts/summary");
    }
    
    @Test
    @DisplayName("Should report 401 and 403 as unauthorized without retrying")
    void shouldReportUnauthorized() {
        HttpSourceClient client = client(request -> json(HttpStatus.FORBIDDEN, "{}"), 2);
        
        StepVerifier.create(client.fetch(SourceKind.STATUS, null))
            .assertNext(result -> {
                assertThat(result.isSuccess()).isFalse();
                assertThat(result.getError().get().getKind()).isEqualTo(FetchErrorKind.UNAUTHORIZED);
                assertThat(result.getError().get().getOccurredAt()).isEqualTo(NOW);
            })
            .verifyComplete();
        
        assertThat(requests).hasSize(1);
        assertThat(metrics.getFailureCount(SourceKind.STATUS, FetchErrorKind.UNAUTHORIZED)).isEqualTo(1.0);
    }
    
    @Test
    @DisplayName("Should report other non-2xx statuses as bad responses")
    void shouldReportBadStatus() {
        HttpSourceClient client = client(request -> json(HttpStatus.NOT_FOUND, "{}"), 2);
        
        StepVerifier.create(client.fetch(SourceKind.STATUS, null))
            .assertNext(result -> {
                assertThat(result.getError().get().getKind()).isEqualTo(FetchErrorKind.BAD_RESPONSE);
                assertThat(result.getError().get().getDetail()).contains("404");
            })
            .verifyComplete();
        
        assertThat(requests).hasSize(1);
    }
    
    @Test
    @DisplayName("Should report malformed bodies as bad responses")
    void shouldReportMalformedBody() {
        HttpSourceClient client = client(request -> json(HttpStatus.OK, "not json"), 2);
        
        StepVerifier.create(client.fetch(SourceKind.STATUS, null))
            .assertNext(result -> {
                assertThat(result.getError().get().getKind()).isEqualTo(FetchErrorKind.BAD_RESPONSE);
                assertThat(result.getError().get().getDetail()).contains("Malformed JSON");
            })
            .verifyComplete();
    }
    
    @Test
    @DisplayName("Should report an empty body as a bad response")
    void shouldReportEmptyBody() {
        HttpSourceClient client = client(request -> Mono.just(ClientResponse.create(HttpStatus.OK).build()), 0);
        
        StepVerifier.create(client.fetch(SourceKind.STATUS, null))
            .assertNext(result -> assertThat(result.getError().get().getKind()).isEqualTo(FetchErrorKind.BAD_RESPONSE))
            .verifyComplete();
    }
    
    @Test
    @DisplayName("Should retry server errors and succeed on a later attempt")
    void shouldRetryServerErrors() {
        AtomicInteger attempts = new AtomicInteger();
        HttpSourceClient client = client(request -> attempts.incrementAndGet() == 1
            ? json(HttpStatus.SERVICE_UNAVAILABLE, "{}")
            : json(HttpStatus.OK, "{\"status\": \"running\"}"), 1);
        
        StepVerifier.create(client.fetch(SourceKind.STATUS, null))
            .assertNext(result -> assertThat(result.isSuccess()).isTrue())
            .verifyComplete();
        
        assertThat(attempts.get()).isEqualTo(2);
    }
    
    @Test
    @DisplayName("Should report connection failures as unreachable after retries")
    void shouldReportUnreachable() {
        AtomicInteger attempts = new AtomicInteger();
        HttpSourceClient client = client(request -> {
            attempts.incrementAndGet();
            return Mono.error(new WebClientRequestException(new ConnectException("Connection refused"),
                HttpMethod.GET, request.url(), HttpHeaders.EMPTY));
        }, 1);
        
        StepVerifier.create(client.fetch(SourceKind.NETWORK, 900))
            .assertNext(result -> {
                assertThat(result.getError().get().getKind()).isEqualTo(FetchErrorKind.UNREACHABLE);
                assertThat(result.getError().get().getDetail()).contains("Connection refused");
            })
            .verifyComplete();
        
        assertThat(attempts.get()).isEqualTo(2);
    }
    
    @Test
    @DisplayName("Should report a source that never answers as a timeout")
    void shouldReportTimeout() {
        HttpSourceClient client = client(request -> Mono.never(), 0);
        
        StepVerifier.create(client.fetch(SourceKind.LOGS, 3600))
            .assertNext(result -> assertThat(result.getError().get().getKind()).isEqualTo(FetchErrorKind.TIMEOUT))
            .expectComplete()
            .verify(Duration.ofSeconds(5));
        
        assertThat(metrics.getFailureCount(SourceKind.LOGS, FetchErrorKind.TIMEOUT)).isEqualTo(1.0);
    }
}
