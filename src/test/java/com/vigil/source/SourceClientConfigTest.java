package com.vigil.source;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SourceClientConfig Tests")
class SourceClientConfigTest {
    
    private ClientRequest send(String apiKey) {
        SourceClientConfig config = new SourceClientConfig();
        ReflectionTestUtils.setField(config, "baseUrl", "http://source.test/api");
        ReflectionTestUtils.setField(config, "apiKey", apiKey);
        
        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            captured.set(request);
            return Mono.just(ClientResponse.create(HttpStatus.OK).build());
        });
        
        config.telemetryWebClient(builder).get().uri("/status").retrieve().toBodilessEntity().block();
        return captured.get();
    }
    
    @Test
    @DisplayName("Should send the API key header when one is configured")
    void shouldSendApiKey() {
        ClientRequest request = send("secret-key");
        
        assertThat(request.url().toString()).isEqualTo("http://source.test/api/status");
        assertThat(request.headers().getFirst("X-API-Key")).isEqualTo("secret-key");
    }
    
    @Test
    @DisplayName("Should omit the API key header when none is configured")
    void shouldOmitBlankApiKey() {
        ClientRequest request = send("");
        
        assertThat(request.headers().containsKey("X-API-Key")).isFalse();
    }
}
