package com.openforge.llmkit.llm.openai;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Request body for POST /v1/embeddings.
 *
 * Wire format:
 * {
 *   "model": "text-embedding-3-small",
 *   "input": "text to embed"
 * }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OpenAiEmbeddingRequest(
        String model,
        String input
) {}
