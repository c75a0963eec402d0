package com.openforge.llmkit.llm.openai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A single tool invocation request produced by the model.
 *
 * Example:
 *   { "id": "call_abc", "type": "function",
 *     "function": { "name": "weather", "arguments": "{\"city\":\"London\"}" } }
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OpenAiToolCall(
        String id,
        String type,
        Function function
) {

    /**
     * "arguments" is normally a JSON-encoded string. Some OpenAI-compatible
     * servers send the object itself, so it is kept as a JsonNode and
     * normalised by the backend.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Function(
            String name,
            JsonNode arguments
    ) {}
}
