package com.legalsearch.service.embedding;

import com.legalsearch.exception.EmbeddingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Embedding through a Spring AI {@link EmbeddingModel} backed by Ollama.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "legal-search.embedding", name = "provider", havingValue = "ollama")
public class OllamaEmbeddingProvider implements EmbeddingProvider {

    private final EmbeddingModel embeddingModel;

    @Override
    public List<Double> embedQuery(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new IllegalArgumentException("Text is empty");
        }

        float[] output;
        try {
            output = embeddingModel.embed(text);
        } catch (Exception e) {
            log.error("Ollama embedding failed: {}", e.getMessage());
            throw new EmbeddingException("Failed to generate embedding via Ollama", e);
        }

        if (output == null || output.length == 0) {
            throw new EmbeddingException("Empty embedding returned by Ollama");
        }

        List<Double> vector = new ArrayList<>(output.length);
        for (float v : output) {
            vector.add((double) v);
        }
        return vector;
    }

    @Override
    public String name() {
        return "ollama";
    }
}
