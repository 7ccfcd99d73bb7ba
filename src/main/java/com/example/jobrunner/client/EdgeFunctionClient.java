package com.example.jobrunner.client;

import com.example.jobrunner.config.EdgeFunctionProperties;
import com.example.jobrunner.exception.ExternalServiceException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Client for the edge function gateway.
 * <p>
 * Every function is invoked as {@code POST /functions/v1/{name}} with a JSON body
 * and is expected to answer with a JSON object. The client knows nothing about
 * what a function does.
 * <p>
 * Uses:
 * - Resilience4j Circuit Breaker for fault tolerance
 * - Retry for transient failures
 * - WebClient with a per-call timeout
 */
@Slf4j
@Component
public class EdgeFunctionClient {

    static final String SERVICE_NAME = "Edge Functions";

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT = new ParameterizedTypeReference<>() {
    };

    private final WebClient webClient;
    private final EdgeFunctionProperties properties;

    public EdgeFunctionClient(@Qualifier("edgeFunctionWebClient") WebClient webClient, EdgeFunctionProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    /**
     * Invoke a function by name
     *
     * @param functionName the function to call
     * @param body         JSON-serializable input
     * @return the function's JSON response, empty when it returned no body
     * @throws ExternalServiceException if the call fails or returns an error status
     */
    @CircuitBreaker(name = "edgeFunctions", fallbackMethod = "invokeFallback")
    @Retry(name = "edgeFunctions")
    public Map<String, Object> invoke(String functionName, Map<String, Object> body) {
        log.info("Invoking edge function: {}", functionName);

        try {
            var response = webClient.post()
                    .uri("/functions/v1/{functionName}", functionName)
                    .bodyValue(body != null ? body : Map.of())
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, clientResponse ->
                            clientResponse.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(errorBody -> Mono.error(
                                            new ExternalServiceException(SERVICE_NAME, clientResponse.statusCode().value(), errorBody))))
                    .bodyToMono(JSON_OBJECT)
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .block();
            return response != null ? response : new HashMap<>();
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to invoke edge function {}: {}", functionName, e.getMessage());
            throw new ExternalServiceException(SERVICE_NAME, e);
        }
    }

    /**
     * Fallback when the call failed or the circuit breaker is open
     */
    @SuppressWarnings("unused")
    private Map<String, Object> invokeFallback(String functionName, Map<String, Object> body, Exception e) {
        if (e instanceof CallNotPermittedException) {
            log.warn("Circuit breaker open for edge functions, function: {}", functionName);
            throw new ExternalServiceException(SERVICE_NAME, "Service temporarily unavailable (circuit breaker open)", e);
        }
        if (e instanceof ExternalServiceException externalServiceException) {
            throw externalServiceException;
        }
        throw new ExternalServiceException(SERVICE_NAME, e);
    }
}
