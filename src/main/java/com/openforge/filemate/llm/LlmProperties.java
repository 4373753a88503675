package com.openforge.filemate.llm;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Externalised LLM provider configuration.
 *
 * Reads from application.yml under the "filemate.llm" prefix:
 *
 * filemate:
 *   llm:
 *     enabled: true
 *     temperature: 0.3
 *     max-tokens: 1000
 *     primary:
 *       name: openai
 *       base-url: https://api.openai.com/v1
 *       api-key: ${FILEMATE_LLM_API_KEY:}
 *       model: gpt-4o-mini
 *       timeout-seconds: 30
 *     fallback:                 # optional
 *       name: deepseek
 *       base-url: https://api.deepseek.com/v1
 *       api-key: ${FILEMATE_LLM_FALLBACK_API_KEY:}
 *       model: deepseek-chat
 *
 * A provider without base URL or API key counts as not configured; with no
 * configured primary the oracle is switched off and rules decide alone.
 */
@Validated
@ConfigurationProperties(prefix = "filemate.llm")
public record LlmProperties(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("0.3") @DecimalMin("0.0") @DecimalMax("2.0") double temperature,
        @DefaultValue("1000") @Min(1) int maxTokens,
        @Valid ProviderConfig primary,
        @Valid ProviderConfig fallback
) {

    public record ProviderConfig(
            @DefaultValue("primary") String name,
            String baseUrl,
            String apiKey,
            String model,
            @DefaultValue("30") @Min(1) int timeoutSeconds
    ) {

        public boolean isConfigured() {
            return baseUrl != null && !baseUrl.isBlank()
                    && apiKey != null && !apiKey.isBlank();
        }
    }

    public boolean primaryConfigured() {
        return primary != null && primary.isConfigured();
    }

    public boolean fallbackConfigured() {
        return fallback != null && fallback.isConfigured();
    }
}
