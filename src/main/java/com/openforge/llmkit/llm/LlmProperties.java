package com.openforge.llmkit.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Externalised LLM backend configuration.
 *
 * Reads from application.yml under the "llm" prefix:
 *
 * llm:
 *   backend:
 *     generation: ollama        # ollama | openai
 *     embeddings: ollama
 *   ollama:
 *     base-url: http://localhost:11434
 *     gen-model: qwen2.5
 *     emb-model: mxbai-embed-large
 *     timeout-seconds: 30
 *   openai:
 *     base-url: https://api.openai.com
 *     api-key: sk-...
 *     gen-model: gpt-4o-mini
 *     emb-model: text-embedding-3-small
 *     timeout-seconds: 30
 */
@ConfigurationProperties(prefix = "llm")
public record LlmProperties(
        @DefaultValue BackendSelection backend,
        @DefaultValue ProviderConfig ollama,
        @DefaultValue ProviderConfig openai
) {

    /** Which provider serves which purpose. */
    public record BackendSelection(
            @DefaultValue("ollama") String generation,
            @DefaultValue("ollama") String embeddings
    ) {}

    /**
     * Connection settings for one provider. A null base URL means "the
     * provider's public default".
     */
    public record ProviderConfig(
            String baseUrl,
            String apiKey,
            String genModel,
            String embModel,
            @DefaultValue("30") int timeoutSeconds
    ) {

        public Duration timeout() {
            return Duration.ofSeconds(timeoutSeconds);
        }
    }
}
