package com.legalsearch.service.index;

import com.legalsearch.dto.internal.SearchHit;
import com.legalsearch.exception.VectorIndexException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Exact cosine search over a corpus held in memory. Suitable for local runs and
 * small exports; distance is {@code 1 - cosine}.
 */
@Slf4j
public class InMemoryVectorIndex implements VectorIndex {

    private final List<IndexedPassage> passages;

    public InMemoryVectorIndex(List<IndexedPassage> passages) {
        this.passages = List.copyOf(passages);
        log.info("In-memory vector index ready ({} passages)", this.passages.size());
    }

    @Override
    public List<SearchHit> search(List<Double> vector, int k, Map<String, String> filter) {
        if (vector == null || vector.isEmpty()) {
            throw new VectorIndexException("Query vector is empty");
        }
        if (k < 1 || passages.isEmpty()) {
            return List.of();
        }

        double[] query = toArray(vector);
        List<Scored> scored = new ArrayList<>();

        for (IndexedPassage candidate : passages) {
            if (!matches(candidate, filter)) {
                continue;
            }
            if (candidate.vector().length != query.length) {
                log.warn("Skipping passage {}: dimension {} != query dimension {}",
                        candidate.passage().getId(), candidate.vector().length, query.length);
                continue;
            }
            scored.add(new Scored(candidate, 1.0 - cosineSimilarity(query, candidate.vector())));
        }

        return scored.stream()
                .sorted(Comparator.comparingDouble(Scored::distance))
                .limit(k)
                .map(s -> SearchHit.of(s.passage().passage(), s.distance(), "memory"))
                .toList();
    }

    @Override
    public long count() {
        return passages.size();
    }

    @Override
    public String name() {
        return "in-memory";
    }

    private static boolean matches(IndexedPassage candidate, Map<String, String> filter) {
        if (filter == null || filter.isEmpty()) {
            return true;
        }
        for (Map.Entry<String, String> entry : filter.entrySet()) {
            String actual = PassageMetadataMapper.fieldValue(candidate.passage(), entry.getKey());
            if (actual == null || !actual.equals(entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    static double cosineSimilarity(double[] a, double[] b) {
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;

        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }

        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private static double[] toArray(List<Double> vector) {
        double[] out = new double[vector.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = vector.get(i);
        }
        return out;
    }

    private record Scored(IndexedPassage passage, double distance) {
    }
}
