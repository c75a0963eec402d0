package com.openforge.llmkit.llm.ollama;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Non-streaming response of /api/chat ("message") and /api/generate ("response").
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OllamaResponse(
        String model,
        @JsonProperty("created_at") String createdAt,
        ResponseMessage message,
        String response,
        boolean done,
        @JsonProperty("done_reason") String doneReason
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ResponseMessage(
            String role,
            String content,
            @JsonProperty("tool_calls") List<OllamaToolCall> toolCalls
    ) {}
}
