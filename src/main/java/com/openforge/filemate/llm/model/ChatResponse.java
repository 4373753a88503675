package com.openforge.filemate.llm.model;

import java.util.List;

/**
 * Top-level response from /chat/completions.
 */
public record ChatResponse(
        String id,
        String object,
        Long created,
        String model,
        List<Choice> choices,
        Usage usage
) {

    /** Convenience: first choice message (always present for a successful response). */
    public Message firstMessage() {
        if (choices == null || choices.isEmpty() || choices.get(0).message() == null) {
            throw new IllegalStateException("LLM returned no choices in response: " + id);
        }
        return choices.get(0).message();
    }

    /** Text of the first choice; empty string when the model sent no content. */
    public String firstContent() {
        String content = firstMessage().content();
        return content == null ? "" : content;
    }

    public record Choice(
            int index,
            Message message,
            String finishReason
    ) {}

    public record Usage(
            int promptTokens,
            int completionTokens,
            int totalTokens
    ) {}
}
