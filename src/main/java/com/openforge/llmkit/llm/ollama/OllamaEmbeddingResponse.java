package com.openforge.llmkit.llm.ollama;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Response of POST /api/embeddings: { "embedding": [0.1, -0.2, ...] }
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OllamaEmbeddingResponse(List<Float> embedding) {}
