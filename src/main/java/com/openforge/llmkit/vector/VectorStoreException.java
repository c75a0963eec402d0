package com.openforge.llmkit.vector;

/**
 * Raised when a vector-store operation cannot be routed or the store fails.
 */
public class VectorStoreException extends RuntimeException {

    public VectorStoreException(String message) {
        super(message);
    }

    public VectorStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
