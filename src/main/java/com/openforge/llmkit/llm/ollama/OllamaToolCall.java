package com.openforge.llmkit.llm.ollama;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Ollama tool call. Unlike OpenAI there is no id and "arguments" is an object.
 *
 *   { "function": { "name": "weather", "arguments": { "city": "London" } } }
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OllamaToolCall(Function function) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Function(
            String name,
            JsonNode arguments
    ) {}
}
