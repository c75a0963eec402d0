package com.openforge.llmkit.llm.ollama;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Request body for POST /api/generate: a single flattened prompt.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OllamaGenerateRequest(
        String model,
        String prompt,
        boolean stream,
        OllamaOptions options
) {}
