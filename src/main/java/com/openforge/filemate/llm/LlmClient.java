package com.openforge.filemate.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.filemate.llm.model.ChatRequest;
import com.openforge.filemate.llm.model.ChatResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Stateless client for one OpenAI-compatible provider.
 *
 * {@link #chat} is blocking and bounded by the provider's timeout; every
 * failure surfaces as an {@link LlmException} subtype so the router can
 * decide what is worth retrying.
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

    // ── Public API ───────────────────────────────────────────────────────────

    public ChatResponse chat(ChatRequest request) {
        if (request == null) {
            throw new LlmException("ChatRequest must not be null for provider [%s]".formatted(config.name()));
        }
        ChatRequest effective = request.model() == null || request.model().isBlank()
                ? request.toBuilder().model(config.model()).build()
                : request;

        String requestBody = serialize(effective);
        log.debug("[LlmClient:{}] → chat POST body-length={}", config.name(), requestBody.length());

        return parseFullResponse(sendBlocking(buildHttpRequest(requestBody)));
    }

    /** The model name configured for this provider (e.g. "gpt-4o-mini"). */
    public String modelName() {
        return config.model();
    }

    public String providerName() {
        return config.name();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private HttpRequest buildHttpRequest(String body) {
        return HttpRequest.newBuilder()
                .uri(URI.create(stripTrailingSlash(config.baseUrl()) + "/chat/completions"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + config.apiKey())
                .timeout(Duration.ofSeconds(config.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
    }

    private HttpResponse<String> sendBlocking(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new LlmNetworkException("Timed out after %ds calling provider [%s]"
                    .formatted(config.timeoutSeconds(), config.name()), e);
        } catch (IOException e) {
            throw new LlmNetworkException("Network error calling provider [%s]".formatted(config.name()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("Interrupted while calling provider [%s]".formatted(config.name()), e);
        }
    }

    private ChatResponse parseFullResponse(HttpResponse<String> response) {
        int    status = response.statusCode();
        String body   = response.body();
        log.debug("[LlmClient:{}] ← HTTP {} body-length={}", config.name(), status,
                body == null ? 0 : body.length());

        if (status == 429) throw new LlmRateLimitException(
                "Rate-limited by provider [%s].".formatted(config.name()));
        if (status < 200 || status >= 300) throw new LlmException(
                "Provider [%s] returned HTTP %d: %s".formatted(config.name(), status, abbreviate(body)));

        try {
            return objectMapper.readValue(body, ChatResponse.class);
        } catch (JsonProcessingException e) {
            throw new LlmException(
                    "Failed to parse response from provider [%s]: %s".formatted(config.name(), abbreviate(body)), e);
        }
    }

    private String serialize(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new LlmException("Failed to serialize request", e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= 512 ? body : body.substring(0, 512) + "…";
    }

    // ── Exception types ──────────────────────────────────────────────────────

    public static class LlmException extends RuntimeException {
        public LlmException(String message) { super(message); }
        public LlmException(String message, Throwable cause) { super(message, cause); }
    }

    /** Timeouts and connection failures; worth retrying. */
    public static class LlmNetworkException extends LlmException {
        public LlmNetworkException(String message, Throwable cause) { super(message, cause); }
    }

    public static class LlmRateLimitException extends LlmException {
        public LlmRateLimitException(String message) { super(message); }
    }
}
