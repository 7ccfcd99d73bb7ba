package com.example.jobrunner.client;

import com.example.jobrunner.config.EdgeFunctionProperties;
import com.example.jobrunner.exception.ExternalServiceException;
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
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

@DisplayName("EdgeFunctionClient Tests")
class EdgeFunctionClientTest {

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();
    private EdgeFunctionProperties properties;

    @BeforeEach
    void setUp() {
        properties = new EdgeFunctionProperties();
        properties.setBaseUrl("http://edge.local");
        properties.setTimeoutSeconds(5);
    }

    private EdgeFunctionClient client(ExchangeFunction exchange) {
        ExchangeFunction recording = request -> {
            lastRequest.set(request);
            return exchange.exchange(request);
        };
        var webClient = WebClient.builder()
                .baseUrl(properties.getBaseUrl())
                .exchangeFunction(recording)
                .build();
        return new EdgeFunctionClient(webClient, properties);
    }

    private static ExchangeFunction respond(HttpStatus status, String body) {
        return request -> Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }

    @Test
    @DisplayName("Should POST to the function path and return the JSON object")
    void shouldInvokeFunction() {
        var client = client(respond(HttpStatus.OK, "{\"processed\": 3, \"status\": \"ok\"}"));

        var response = client.invoke("memory-consolidator", Map.of("action", "consolidate_all"));

        assertThat(response).containsEntry("processed", 3).containsEntry("status", "ok");
        assertThat(lastRequest.get().method()).isEqualTo(HttpMethod.POST);
        assertThat(lastRequest.get().url().getPath()).isEqualTo("/functions/v1/memory-consolidator");
    }

    @Test
    @DisplayName("Should return empty map when the function returns no body")
    void shouldHandleEmptyBody() {
        var client = client(request -> Mono.just(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build()));

        assertThat(client.invoke("vectorize-agent-resources", null)).isEmpty();
    }

    @Test
    @DisplayName("Should raise retryable exception on server error")
    void shouldRaiseRetryableOnServerError() {
        var client = client(respond(HttpStatus.INTERNAL_SERVER_ERROR, "{\"error\": \"crashed\"}"));

        assertThatThrownBy(() -> client.invoke("cron-learning-pipeline", Map.of()))
                .isInstanceOfSatisfying(ExternalServiceException.class, e -> {
                    assertThat(e.getHttpStatusCode()).isEqualTo(500);
                    assertThat(e.isRetryable()).isTrue();
                    assertThat(e.getResponseBody()).contains("crashed");
                });
    }

    @Test
    @DisplayName("Should raise non-retryable exception on client error")
    void shouldRaiseNonRetryableOnClientError() {
        var client = client(respond(HttpStatus.BAD_REQUEST, "{\"error\": \"missing action\"}"));

        assertThatThrownBy(() -> client.invoke("marketing-campaign-manager", Map.of()))
                .isInstanceOfSatisfying(ExternalServiceException.class, e -> {
                    assertThat(e.getHttpStatusCode()).isEqualTo(400);
                    assertThat(e.isRetryable()).isFalse();
                });
    }

    @Test
    @DisplayName("Should wrap transport errors")
    void shouldWrapTransportErrors() {
        var client = client(request -> Mono.error(new ConnectException("Connection refused")));

        assertThatThrownBy(() -> client.invoke("memory-consolidator", Map.of()))
                .isInstanceOfSatisfying(ExternalServiceException.class, e -> {
                    assertThat(e.getHttpStatusCode()).isNull();
                    assertThat(e.isRetryable()).isTrue();
                    assertThat(e.getServiceName()).isEqualTo(EdgeFunctionClient.SERVICE_NAME);
                });
    }
}
