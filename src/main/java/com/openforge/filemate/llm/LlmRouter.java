package com.openforge.filemate.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.filemate.llm.model.ChatRequest;
import com.openforge.filemate.llm.model.ChatResponse;
import com.openforge.filemate.llm.model.Message;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.List;
import java.util.function.Supplier;

/**
 * Routes chat requests to the primary provider, falling back to the
 * secondary one when the primary fails for good.
 *
 * Each provider call is wrapped as CircuitBreaker(Retry(call)): retries
 * absorb transient network errors and rate limits, the breaker stops
 * hammering a provider that keeps failing.  Once the primary's breaker is
 * OPEN, requests go straight to the fallback until it half-opens again.
 *
 * Without a configured primary the router reports itself unavailable and
 * callers are expected not to call {@link #chat}.
 */
@Slf4j
@Component
@EnableConfigurationProperties(LlmProperties.class)
public class LlmRouter {

    private final LlmProperties  properties;
    private final LlmClient      primaryClient;
    private final LlmClient      fallbackClient;
    private final CircuitBreaker primaryCb;
    private final CircuitBreaker fallbackCb;
    private final Retry          primaryRetry;
    private final Retry          fallbackRetry;

    public LlmRouter(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties properties,
                     CircuitBreaker primaryLlmCircuitBreaker,
                     CircuitBreaker fallbackLlmCircuitBreaker,
                     Retry primaryLlmRetry,
                     Retry fallbackLlmRetry) {
        this.properties     = properties;
        this.primaryClient  = properties.primaryConfigured()
                ? new LlmClient(httpClient, objectMapper, properties.primary()) : null;
        this.fallbackClient = properties.fallbackConfigured()
                ? new LlmClient(httpClient, objectMapper, properties.fallback()) : null;
        this.primaryCb      = primaryLlmCircuitBreaker;
        this.fallbackCb     = fallbackLlmCircuitBreaker;
        this.primaryRetry   = primaryLlmRetry;
        this.fallbackRetry  = fallbackLlmRetry;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    public boolean isAvailable() {
        return properties.enabled() && primaryClient != null;
    }

    public boolean hasFallback() {
        return fallbackClient != null;
    }

    /** Convenience: system + user prompt with the configured sampling settings. */
    public String complete(String systemPrompt, String userPrompt) {
        ChatRequest request = ChatRequest.of(
                List.of(Message.system(systemPrompt), Message.user(userPrompt)),
                properties.temperature(),
                properties.maxTokens());
        return chat(request).firstContent();
    }

    /**
     * Route a chat request through primary → fallback with full resilience.
     *
     * The model field in ChatRequest is overridden by the provider's own
     * configured model name, so callers only pass messages and sampling settings.
     */
    public ChatResponse chat(ChatRequest request) {
        if (!isAvailable()) {
            throw new LlmClient.LlmException("No LLM provider is configured");
        }
        try {
            ChatRequest primaryRequest = request.toBuilder().model(primaryClient.modelName()).build();
            return executeWithResilience(primaryCb, primaryRetry,
                    () -> primaryClient.chat(primaryRequest), "primary");
        } catch (RuntimeException primaryException) {
            if (fallbackClient == null) {
                throw primaryException;
            }
            log.warn("[LlmRouter] Primary provider failed ({}), engaging fallback. Cause: {}",
                    primaryException.getClass().getSimpleName(), primaryException.getMessage());

            ChatRequest fallbackRequest = request.toBuilder().model(fallbackClient.modelName()).build();
            return executeWithResilience(fallbackCb, fallbackRetry,
                    () -> fallbackClient.chat(fallbackRequest), "fallback");
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    /**
     * Decorates a supplier with circuit-breaker + retry, then executes it.
     * Fully programmatic — no AOP proxies, no annotations.
     */
    private ChatResponse executeWithResilience(CircuitBreaker cb,
                                               Retry retry,
                                               Supplier<ChatResponse> call,
                                               String label) {
        Supplier<ChatResponse> decorated =
                CircuitBreaker.decorateSupplier(cb,
                        Retry.decorateSupplier(retry, call));
        try {
            return decorated.get();
        } catch (RuntimeException e) {
            throw new LlmClient.LlmException(
                    "[LlmRouter] %s provider ultimately failed: %s".formatted(label, e.getMessage()), e);
        }
    }
}
