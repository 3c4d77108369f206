package com.example.jobscheduler.client;

import com.example.jobscheduler.exception.ExternalServiceException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Client for arbitrary HTTP callback targets.
 * <p>
 * Uses:
 * - Resilience4j Circuit Breaker shared by all callback targets
 * - WebClient, blocking on the handler thread
 * <p>
 * No retry here: the job executor owns the retry loop.
 */
@Slf4j
@Component
public class CallbackClient {

    static final String TARGET = "Callback";

    private final WebClient webClient;

    public CallbackClient(@Qualifier("callbackWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    /**
     * POST a JSON body to the given URL
     *
     * @return response body, empty when the target returns none
     * @throws ExternalServiceException if the call fails or returns an error status
     */
    @CircuitBreaker(name = "httpCallback", fallbackMethod = "postFallback")
    public String post(String url, String body) {
        log.info("Posting callback to {}", url);

        try {
            var response = webClient.post()
                    .uri(url)
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, clientResponse ->
                            clientResponse.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(responseBody -> Mono.error(
                                            new ExternalServiceException(TARGET, clientResponse.statusCode().value(), responseBody))))
                    .bodyToMono(String.class)
                    .block();
            return response != null ? response : "";
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Callback to {} failed: {}", url, e.getMessage());
            throw new ExternalServiceException(TARGET, e.getMessage(), e);
        }
    }

    /**
     * Fallback when the circuit breaker is open. Other failures propagate unchanged.
     */
    @SuppressWarnings("unused")
    private String postFallback(String url, String body, CallNotPermittedException e) {
        log.warn("Circuit breaker open for callbacks, url: {}", url);
        throw new ExternalServiceException(TARGET, "Callbacks temporarily unavailable (circuit breaker open)", e);
    }
}
