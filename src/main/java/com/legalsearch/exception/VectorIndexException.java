package com.legalsearch.exception;

/**
 * Vector index transport, auth or protocol failure. An empty result is not an error.
 */
public class VectorIndexException extends RetrievalException {

    public VectorIndexException(String message) {
        super(message);
    }

    public VectorIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
