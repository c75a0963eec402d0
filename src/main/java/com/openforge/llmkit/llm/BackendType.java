package com.openforge.llmkit.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.llmkit.llm.ollama.OllamaBackend;
import com.openforge.llmkit.llm.openai.OpenAiBackend;

import java.net.http.HttpClient;
import java.util.Locale;

/**
 * Supported providers, selected by the names used in "llm.backend.*".
 */
public enum BackendType {

    OLLAMA(OllamaBackend.NAME) {
        @Override
        protected LlmProperties.ProviderConfig config(LlmProperties properties) {
            return properties.ollama();
        }

        @Override
        protected LlmBackend create(HttpClient httpClient, ObjectMapper objectMapper,
                                    LlmProperties.ProviderConfig config, String model) {
            return new OllamaBackend(httpClient, objectMapper, config, model);
        }
    },

    OPENAI(OpenAiBackend.NAME) {
        @Override
        protected LlmProperties.ProviderConfig config(LlmProperties properties) {
            return properties.openai();
        }

        @Override
        protected LlmBackend create(HttpClient httpClient, ObjectMapper objectMapper,
                                    LlmProperties.ProviderConfig config, String model) {
            return new OpenAiBackend(httpClient, objectMapper, config, model);
        }
    };

    private final String configName;

    BackendType(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    protected abstract LlmProperties.ProviderConfig config(LlmProperties properties);

    protected abstract LlmBackend create(HttpClient httpClient, ObjectMapper objectMapper,
                                         LlmProperties.ProviderConfig config, String model);

    /** Backend configured with the provider's generation model. */
    public LlmBackend generationBackend(HttpClient httpClient, ObjectMapper objectMapper, LlmProperties properties) {
        LlmProperties.ProviderConfig config = config(properties);
        return create(httpClient, objectMapper, config, config.genModel());
    }

    /** Backend configured with the provider's embedding model. */
    public LlmBackend embeddingBackend(HttpClient httpClient, ObjectMapper objectMapper, LlmProperties properties) {
        LlmProperties.ProviderConfig config = config(properties);
        return create(httpClient, objectMapper, config, config.embModel());
    }

    /**
     * @throws IllegalStateException for a name no provider answers to
     */
    public static BackendType fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (BackendType type : values()) {
                if (type.configName.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalStateException("Unknown LLM backend: " + name);
    }
}
