package com.openforge.llmkit.vector;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Connection parameters for the Milvus vector database.
 *
 * application.yml:
 *
 * vector:
 *   milvus:
 *     enabled: true
 *     host: localhost
 *     port: 19530
 *     collection-prefix: documents
 *     top-k: 5
 *     collections:          # embedding backend -> vector dimension
 *       openai: 1536
 *       ollama: 1024
 */
@ConfigurationProperties(prefix = "vector.milvus")
public record MilvusProperties(
        @DefaultValue("false")     boolean enabled,
        @DefaultValue("localhost") String  host,
        @DefaultValue("19530")     int     port,
        @DefaultValue("documents") String  collectionPrefix,
        @DefaultValue("5")         int     topK,
        Map<String, Integer> collections
) {

    public static final Map<String, Integer> DEFAULT_COLLECTIONS = Map.of(
            "openai", 1536,
            "ollama", 1024);

    public MilvusProperties {
        collections = collections == null || collections.isEmpty()
                ? DEFAULT_COLLECTIONS
                : Map.copyOf(new LinkedHashMap<>(collections));
        requireDistinctDimensions(collections);
    }

    /** Writes are routed by vector length, so two backends cannot share a dimension. */
    private static void requireDistinctDimensions(Map<String, Integer> collections) {
        Map<Integer, String> seen = new HashMap<>();
        for (Map.Entry<String, Integer> entry : collections.entrySet()) {
            String previous = seen.putIfAbsent(entry.getValue(), entry.getKey());
            if (previous != null) {
                throw new IllegalArgumentException(
                        "vector.milvus.collections: '%s' and '%s' both use dimension %d"
                                .formatted(previous, entry.getKey(), entry.getValue()));
            }
        }
    }

    public String collectionName(String selector) {
        return collectionPrefix + "_" + selector;
    }
}
