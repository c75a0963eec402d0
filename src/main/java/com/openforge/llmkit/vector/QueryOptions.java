package com.openforge.llmkit.vector;

/**
 * Options for {@link VectorDatabase#queryRelevantDocuments}.
 *
 * @param limit maximum number of documents to return, at least 1
 */
public record QueryOptions(int limit) {

    public static final int DEFAULT_LIMIT = 5;

    public QueryOptions {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1, got " + limit);
        }
    }

    public static QueryOptions defaults() {
        return new QueryOptions(DEFAULT_LIMIT);
    }

    public static QueryOptions limit(int limit) {
        return new QueryOptions(limit);
    }
}
