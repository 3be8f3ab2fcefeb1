package com.openforge.taskmate.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.taskmate.llm.model.ChatRequest;
import com.openforge.taskmate.llm.model.ChatResponse;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.function.Supplier;

/**
 * Primary → fallback routing for chat completions.
 *
 *   chat(request)
 *     └─ primary circuit breaker + retry  → primary provider
 *          ↓ any failure, including an OPEN circuit
 *     └─ fallback circuit breaker + retry → fallback provider
 *
 * When both providers fail the last error is rethrown as
 * {@link LlmClient.LlmException}.  The request's model field is replaced
 * with each provider's own configured model.
 */
@Slf4j
@Component
public class LlmRouter {

    private final LlmClient      primaryClient;
    private final LlmClient      fallbackClient;
    private final String         primaryModel;
    private final String         fallbackModel;
    private final CircuitBreaker primaryCb;
    private final CircuitBreaker fallbackCb;
    private final Retry          primaryRetry;
    private final Retry          fallbackRetry;

    public LlmRouter(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties properties,
                     @Qualifier("primaryLlmCircuitBreaker") CircuitBreaker primaryLlmCircuitBreaker,
                     @Qualifier("fallbackLlmCircuitBreaker") CircuitBreaker fallbackLlmCircuitBreaker,
                     @Qualifier("primaryLlmRetry") Retry primaryLlmRetry,
                     @Qualifier("fallbackLlmRetry") Retry fallbackLlmRetry) {
        this.primaryClient  = new LlmClient(httpClient, objectMapper, properties.primary());
        this.fallbackClient = new LlmClient(httpClient, objectMapper, properties.fallback());
        this.primaryModel   = properties.primary().model();
        this.fallbackModel  = properties.fallback().model();
        this.primaryCb      = primaryLlmCircuitBreaker;
        this.fallbackCb     = fallbackLlmCircuitBreaker;
        this.primaryRetry   = primaryLlmRetry;
        this.fallbackRetry  = fallbackLlmRetry;
    }

    public ChatResponse chat(ChatRequest request) {
        try {
            ChatRequest primaryRequest = request.toBuilder().model(primaryModel).build();
            return executeWithResilience(primaryCb, primaryRetry,
                    () -> primaryClient.chat(primaryRequest), primaryClient.providerName());
        } catch (Exception primaryException) {
            log.warn("[LlmRouter] Primary provider failed ({}), engaging fallback. Cause: {}",
                    primaryException.getClass().getSimpleName(), primaryException.getMessage());

            ChatRequest fallbackRequest = request.toBuilder().model(fallbackModel).build();
            return executeWithResilience(fallbackCb, fallbackRetry,
                    () -> fallbackClient.chat(fallbackRequest), fallbackClient.providerName());
        }
    }

    /** Circuit breaker outside, retry inside: one breaker call per retried attempt group. */
    private ChatResponse executeWithResilience(CircuitBreaker cb,
                                               Retry retry,
                                               Supplier<ChatResponse> call,
                                               String label) {
        Supplier<ChatResponse> decorated =
                CircuitBreaker.decorateSupplier(cb, Retry.decorateSupplier(retry, call));
        try {
            return decorated.get();
        } catch (Exception e) {
            throw new LlmClient.LlmException(
                    "[LlmRouter] provider %s ultimately failed: %s".formatted(label, e.getMessage()), e);
        }
    }
}
