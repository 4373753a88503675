package com.openforge.filemate.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * The request body sent to an OpenAI-compatible /chat/completions endpoint.
 * The model is filled in by {@code LlmRouter} from the provider configuration.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatRequest(
        String model,
        List<Message> messages,
        Double temperature,
        Integer maxTokens
) {

    public static ChatRequest of(List<Message> messages, double temperature, int maxTokens) {
        return ChatRequest.builder()
                .messages(messages)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .build();
    }
}
