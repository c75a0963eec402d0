package com.openforge.llmkit.llm.openai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Response from POST /v1/embeddings.
 *
 * Wire format:
 * {
 *   "object": "list",
 *   "data": [
 *     { "object": "embedding", "index": 0, "embedding": [0.1, -0.2, ...] }
 *   ],
 *   "model": "text-embedding-3-small",
 *   "usage": { "prompt_tokens": 8, "total_tokens": 8 }
 * }
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OpenAiEmbeddingResponse(
        String object,
        List<EmbeddingData> data,
        String model,
        Usage usage
) {

    /** The first vector, or null when the response carried none. */
    public List<Float> firstEmbedding() {
        if (data == null || data.isEmpty() || data.get(0) == null) {
            return null;
        }
        return data.get(0).embedding();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EmbeddingData(
            String object,
            int index,
            List<Float> embedding
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Usage(
            int promptTokens,
            int totalTokens
    ) {}
}
