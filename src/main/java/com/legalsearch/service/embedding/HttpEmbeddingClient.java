package com.legalsearch.service.embedding;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import com.legalsearch.config.RetrievalProperties;
import com.legalsearch.exception.EmbeddingException;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;

/**
 * Embedding via the Python sentence-transformers service ({@code POST /embed}).
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "legal-search.embedding", name = "provider", havingValue = "http", matchIfMissing = true)
public class HttpEmbeddingClient implements EmbeddingProvider {

    private final RetrievalProperties properties;
    private final WebClient embeddingWebClient;

    public HttpEmbeddingClient(RetrievalProperties properties,
                               @Qualifier("embeddingWebClient") WebClient embeddingWebClient) {
        this.properties = properties;
        this.embeddingWebClient = embeddingWebClient;
    }

    /**
     * Batch-of-one call. Failures surface as {@link EmbeddingException}, including calls
     * refused while the circuit is open; there is no zero-vector fallback, so callers
     * never search with a meaningless vector. Blank text is a caller error.
     */
    @CircuitBreaker(name = "embedding", fallbackMethod = "circuitOpen")
    @Retry(name = "embedding")
    @Override
    public List<Double> embedQuery(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new IllegalArgumentException("Text is empty");
        }

        try {
            log.debug("Calling embedding service");

            @SuppressWarnings("unchecked")
            Map<String, Object> response =
                embeddingWebClient.post()
                    .uri("/embed")
                    .bodyValue(Map.of("texts", List.of(text)))
                    .retrieve()
                    .bodyToMono(Map.class)
                    .block(Duration.ofSeconds(properties.getEmbedding().getTimeoutSeconds()));

            return firstVector(response);

        } catch (EmbeddingException e) {
            throw e;
        } catch (Exception e) {
            log.error("Embedding service failed: {}", e.getMessage());
            throw new EmbeddingException("Failed to generate embedding", e);
        }
    }

    // only matches CallNotPermittedException; other failures are rethrown as they are
    private List<Double> circuitOpen(String text, CallNotPermittedException e) {
        log.warn("Embedding circuit is open, call not permitted");
        throw new EmbeddingException("Embedding service unavailable (circuit open)", e);
    }

    @Override
    public String name() {
        return "http";
    }

    List<Double> firstVector(Map<String, Object> response) {
        if (response == null || !response.containsKey("embeddings")) {
            throw new EmbeddingException("Invalid response from embedding service");
        }

        Object raw = response.get("embeddings");
        if (!(raw instanceof List) || ((List<?>) raw).isEmpty()
                || !(((List<?>) raw).get(0) instanceof List)) {
            throw new EmbeddingException("Empty embedding response from embedding service");
        }

        List<?> first = (List<?>) ((List<?>) raw).get(0);
        List<Double> vector = new ArrayList<>(first.size());
        for (Object value : first) {
            if (!(value instanceof Number)) {
                throw new EmbeddingException("Non-numeric embedding component: " + value);
            }
            vector.add(((Number) value).doubleValue());
        }

        Integer expected = properties.getEmbedding().getDimension();
        if (expected != null && vector.size() != expected) {
            log.warn("Embedding dimension mismatch: expected {}, got {}", expected, vector.size());
        }
        return vector;
    }
}
