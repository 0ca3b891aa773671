package com.legalsearch.exception;

/**
 * Embedding provider unreachable, misconfigured or returning an unusable response.
 */
public class EmbeddingException extends RetrievalException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
