package com.vigil.source;

import com.vigil.normalization.DecoderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;

/**
 * Configuration for the telemetry source API client.
 */
@Configuration
public class SourceClientConfig {
    private static final Logger logger = LoggerFactory.getLogger(SourceClientConfig.class);
    
    @Value("${vigil.source.base-url:http://localhost:5000/api}")
    private String baseUrl;
    
    @Value("${vigil.source.api-key:}")
    private String apiKey;
    
    @Value("${vigil.source.call-timeout-ms:5000}")
    private long callTimeoutMs;
    
    @Value("${vigil.source.max-retries:1}")
    private int maxRetries;
    
    @Value("${vigil.source.retry-backoff-ms:100}")
    private long retryBackoffMs;
    
    @Bean
    public WebClient telemetryWebClient(WebClient.Builder builder) {
        WebClient.Builder configured = builder.baseUrl(baseUrl);
        if (apiKey != null && !apiKey.isBlank()) {
            configured = configured.defaultHeader("X-API-Key", apiKey);
        }
        return configured.build();
    }
    
    @Bean
    public SourceClient sourceClient(WebClient telemetryWebClient, DecoderRegistry decoderRegistry,
                                     SourceMetrics sourceMetrics, Clock clock) {
        logger.info("Telemetry source client initialized: baseUrl={}, timeout={}ms, retries={}",
            baseUrl, callTimeoutMs, maxRetries);
        return new HttpSourceClient(
            telemetryWebClient,
            decoderRegistry,
            sourceMetrics,
            clock,
            Duration.ofMillis(callTimeoutMs),
            maxRetries,
            Duration.ofMillis(retryBackoffMs));
    }
}
