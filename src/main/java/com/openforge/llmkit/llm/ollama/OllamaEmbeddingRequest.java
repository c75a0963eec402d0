package com.openforge.llmkit.llm.ollama;

/**
 * Request body for POST /api/embeddings.
 *
 * { "model": "mxbai-embed-large", "prompt": "text to embed" }
 */
public record OllamaEmbeddingRequest(
        String model,
        String prompt
) {}
