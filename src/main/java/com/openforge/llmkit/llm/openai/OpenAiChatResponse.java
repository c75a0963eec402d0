package com.openforge.llmkit.llm.openai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Top-level response from /v1/chat/completions.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OpenAiChatResponse(
        String id,
        String object,
        Long created,
        String model,
        List<Choice> choices,
        Usage usage
) {

    /** First choice message, or null when the response carried no choices. */
    public ResponseMessage firstMessage() {
        if (choices == null || choices.isEmpty() || choices.get(0) == null) {
            return null;
        }
        return choices.get(0).message();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Choice(
            int index,
            ResponseMessage message,
            String finishReason
    ) {}

    /**
     * The assistant message. Content is null when the model only emitted tool_calls.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ResponseMessage(
            String role,
            String content,
            List<OpenAiToolCall> toolCalls
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Usage(
            int promptTokens,
            int completionTokens,
            int totalTokens
    ) {}
}
