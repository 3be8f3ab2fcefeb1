package com.openforge.taskmate.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.taskmate.llm.model.ChatRequest;
import com.openforge.taskmate.llm.model.ChatResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Stateless client for one OpenAI-compatible /chat/completions endpoint.
 *
 * Blocking on purpose: a chat turn needs the complete tool-call list before
 * anything can be gated or executed, so there is nothing to gain from
 * streaming partial tokens.
 *
 * Every failure (network, timeout, non-2xx, unparsable body) surfaces as
 * {@link LlmException}; 429 gets its own subtype so the retry policy can
 * tell throttling apart from hard errors.
 */
@Slf4j
public class LlmClient {

    private final HttpClient   httpClient;
    private final ObjectMapper objectMapper;
    private final LlmProperties.ProviderConfig config;

    public LlmClient(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties.ProviderConfig config) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.config       = config;
    }

    public ChatResponse chat(ChatRequest request) {
        if (request == null) {
            throw new LlmException("ChatRequest must not be null for provider [%s]".formatted(config.name()));
        }
        ChatRequest effective = request.model() == null || request.model().isBlank()
                ? request.toBuilder().model(config.model()).build()
                : request;

        String body = serialize(effective);
        log.debug("[LlmClient:{}] → POST /chat/completions model={} body-length={}",
                config.name(), effective.model(), body.length());

        HttpResponse<String> response = send(HttpRequest.newBuilder()
                .uri(URI.create(config.baseUrl() + "/chat/completions"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + config.apiKey())
                .timeout(Duration.ofSeconds(config.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build());

        return parse(response);
    }

    public String providerName() {
        return config.name();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private HttpResponse<String> send(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new LlmException("Provider [%s] timed out after %ds"
                    .formatted(config.name(), config.timeoutSeconds()), e);
        } catch (IOException e) {
            throw new LlmException("Network error calling provider [%s]".formatted(config.name()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("Interrupted while calling provider [%s]".formatted(config.name()), e);
        }
    }

    private ChatResponse parse(HttpResponse<String> response) {
        int    status = response.statusCode();
        String body   = response.body();
        log.debug("[LlmClient:{}] ← HTTP {} body-length={}", config.name(), status, body == null ? 0 : body.length());

        if (status == 429) {
            throw new LlmRateLimitException("Rate-limited by provider [%s]".formatted(config.name()));
        }
        if (status < 200 || status >= 300) {
            throw new LlmException("Provider [%s] returned HTTP %d: %s"
                    .formatted(config.name(), status, abbreviate(body)));
        }
        try {
            return objectMapper.readValue(body, ChatResponse.class);
        } catch (JsonProcessingException e) {
            throw new LlmException("Unparsable response from provider [%s]: %s"
                    .formatted(config.name(), abbreviate(body)), e);
        }
    }

    private String serialize(ChatRequest request) {
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new LlmException("Failed to serialize chat request", e);
        }
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= 512 ? body : body.substring(0, 512) + "...";
    }

    // ── Exception types ──────────────────────────────────────────────────────

    public static class LlmException extends RuntimeException {
        public LlmException(String message) { super(message); }
        public LlmException(String message, Throwable cause) { super(message, cause); }
    }

    public static class LlmRateLimitException extends LlmException {
        public LlmRateLimitException(String message) { super(message); }
    }
}
