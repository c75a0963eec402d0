package com.openforge.llmkit.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.llmkit.llm.BackendType;
import com.openforge.llmkit.llm.LlmBackend;
import com.openforge.llmkit.llm.LlmProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;

/**
 * Builds the two backends named by llm.backend.generation / llm.backend.embeddings.
 * An unknown backend name stops the context from starting.
 */
@Slf4j
@Configuration
public class BackendConfig {

    @Bean
    public LlmBackend generationBackend(HttpClient httpClient, ObjectMapper objectMapper, LlmProperties props) {
        LlmBackend backend = BackendType.fromName(props.backend().generation())
                .generationBackend(httpClient, objectMapper, props);
        log.info("[Backend] Generation backend: {} model={}", backend.name(), backend.model());
        return backend;
    }

    @Bean
    public LlmBackend embeddingBackend(HttpClient httpClient, ObjectMapper objectMapper, LlmProperties props) {
        LlmBackend backend = BackendType.fromName(props.backend().embeddings())
                .embeddingBackend(httpClient, objectMapper, props);
        log.info("[Backend] Embedding backend: {} model={}", backend.name(), backend.model());
        return backend;
    }
}
