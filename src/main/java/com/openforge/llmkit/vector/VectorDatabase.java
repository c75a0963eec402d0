package com.openforge.llmkit.vector;

import java.util.List;
import java.util.Map;

/**
 * Storage for embedded documents, partitioned by embedding backend.
 *
 * Each embedding backend produces vectors of its own dimension, so documents
 * live in one partition per backend. Writes are routed by vector length,
 * reads by the backend name passed as {@code selector}.
 */
public interface VectorDatabase {

    /**
     * Stores {@code content} under a freshly generated id.
     *
     * @return the generated document id ("doc-" followed by a UUID)
     */
    String insertDocument(String content, List<Float> embedding);

    /**
     * Returns up to {@code options.limit()} documents closest to {@code embedding},
     * best match first.
     *
     * @param selector embedding backend name ("openai", "ollama") that produced the vector
     */
    List<Document> queryRelevantDocuments(List<Float> embedding, String selector, QueryOptions options);

    /** Stores or replaces a document with caller-supplied id and metadata. */
    void saveEmbeddings(String docId, List<Float> embedding, Map<String, Object> metadata);

    default List<Document> queryRelevantDocuments(List<Float> embedding, String selector) {
        return queryRelevantDocuments(embedding, selector, QueryOptions.defaults());
    }
}
