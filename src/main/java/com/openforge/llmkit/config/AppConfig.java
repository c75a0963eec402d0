package com.openforge.llmkit.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Core infrastructure beans:
 *  - Java HttpClient      → the only HTTP engine; no WebClient, no RestTemplate
 *  - Jackson ObjectMapper → snake_case ↔ camelCase, tolerant deserialization
 */
@Configuration
public class AppConfig {

    /**
     * Single, shared HttpClient instance.
     * 10 s connect timeout; per-request timeouts are set at call site.
     */
    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Shared ObjectMapper for the provider wire formats:
     *  - snake_case property names (tool_calls, finish_reason …)
     *  - unknown properties silently ignored (APIs add fields without breaking us)
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
