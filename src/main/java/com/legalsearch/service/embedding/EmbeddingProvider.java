package com.legalsearch.service.embedding;

import java.util.List;

/**
 * Maps text to a fixed-dimension vector. Implementations throw
 * {@link com.legalsearch.exception.EmbeddingException} when the provider is
 * unreachable or misconfigured, and {@link IllegalArgumentException} for blank text.
 */
public interface EmbeddingProvider {

    List<Double> embedQuery(String text);

    /**
     * Short name for logs and health output
     */
    String name();
}
