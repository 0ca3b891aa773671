package com.legalsearch.service.data;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.legalsearch.dto.internal.LegalPassage;
import com.legalsearch.exception.RetrievalException;
import com.legalsearch.service.index.IndexedPassage;
import com.legalsearch.service.index.PassageMetadataMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a corpus export (JSON array of passages with precomputed embeddings) for the
 * in-memory index. Entries without text or without a usable vector are skipped.
 */
@Slf4j
@RequiredArgsConstructor
public class PassageCorpusLoader {

    private static final Set<String> RESERVED = Set.of(
            "id", "chunk_id", "text", "document", "content", "embedding", "metadata");

    private final ObjectMapper objectMapper;

    public List<IndexedPassage> load(Path corpusPath) {
        Path path = corpusPath.toAbsolutePath();
        log.info("Loading passage corpus from: {}", path);

        if (!Files.exists(path)) {
            throw new RetrievalException("Corpus file not found: " + path);
        }

        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException e) {
            throw new RetrievalException("Failed to read corpus " + path, e);
        }
    }

    public List<IndexedPassage> load(InputStream in) throws IOException {
        List<Map<String, Object>> raw = objectMapper.readValue(
                in,
                objectMapper.getTypeFactory().constructCollectionType(List.class, Map.class)
        );

        List<IndexedPassage> passages = new ArrayList<>(raw.size());
        int skipped = 0;

        for (int i = 0; i < raw.size(); i++) {
            Map<String, Object> entry = raw.get(i);

            String text = extractText(entry);
            double[] vector = extractVector(entry.get("embedding"));
            if (text == null || text.isBlank() || vector == null) {
                skipped++;
                continue;
            }

            LegalPassage passage = PassageMetadataMapper.toPassage(
                    extractId(entry, i), text, extractMetadata(entry));
            passages.add(new IndexedPassage(passage, vector));
        }

        if (skipped > 0) {
            log.warn("Skipped {} corpus entries without text or embedding", skipped);
        }
        log.info("Loaded {} passages", passages.size());
        return passages;
    }

    // ============================================================
    // Helpers
    // ============================================================

    private String extractText(Map<String, Object> entry) {
        for (String key : List.of("text", "document", "content")) {
            Object value = entry.get(key);
            if (value instanceof String) {
                return (String) value;
            }
        }
        return null;
    }

    private String extractId(Map<String, Object> entry, int index) {
        for (String key : List.of("id", "chunk_id")) {
            Object value = entry.get(key);
            if (value != null) {
                return String.valueOf(value);
            }
        }
        return "passage_" + index;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> extractMetadata(Map<String, Object> entry) {
        Object nested = entry.get("metadata");
        if (nested instanceof Map) {
            return (Map<String, Object>) nested;
        }

        Map<String, Object> flat = new HashMap<>();
        entry.forEach((key, value) -> {
            if (!RESERVED.contains(key)) {
                flat.put(key, value);
            }
        });
        return flat;
    }

    private double[] extractVector(Object value) {
        if (!(value instanceof List) || ((List<?>) value).isEmpty()) {
            return null;
        }
        List<?> list = (List<?>) value;
        double[] vector = new double[list.size()];
        for (int i = 0; i < vector.length; i++) {
            Object component = list.get(i);
            if (!(component instanceof Number)) {
                return null;
            }
            vector[i] = ((Number) component).doubleValue();
        }
        return vector;
    }
}
