package com.legalsearch.service.index;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import com.legalsearch.config.RetrievalProperties;
import com.legalsearch.dto.internal.SearchHit;
import com.legalsearch.exception.VectorIndexException;

import lombok.extern.slf4j.Slf4j;

/**
 * Chroma collection queried over its REST API. Distances are cosine distances
 * (the collection is created with {@code hnsw:space = cosine}).
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "legal-search.index", name = "type", havingValue = "chroma", matchIfMissing = true)
public class ChromaVectorIndex implements VectorIndex {

    private static final List<String> INCLUDE = List.of("documents", "metadatas", "distances");

    private final RetrievalProperties properties;
    private final WebClient chromaWebClient;

    private volatile String collectionId;

    public ChromaVectorIndex(RetrievalProperties properties,
                             @Qualifier("chromaWebClient") WebClient chromaWebClient) {
        this.properties = properties;
        this.chromaWebClient = chromaWebClient;
    }

    @Override
    public List<SearchHit> search(List<Double> vector, int k, Map<String, String> filter) {
        if (vector == null || vector.isEmpty()) {
            throw new VectorIndexException("Query vector is empty");
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query_embeddings", List.of(vector));
        body.put("n_results", k);
        body.put("include", INCLUDE);
        Map<String, Object> where = toWhere(filter);
        if (where != null) {
            body.put("where", where);
        }

        Map<String, Object> response;
        try {
            @SuppressWarnings("unchecked")
            Map<String, Object> raw = chromaWebClient.post()
                    .uri(collectionsPath() + "/" + resolveCollectionId() + "/query")
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(Map.class)
                    .block(timeout());
            response = raw;
        } catch (VectorIndexException e) {
            throw e;
        } catch (Exception e) {
            log.error("Chroma query failed: {}", e.getMessage());
            throw new VectorIndexException("Vector index query failed", e);
        }

        List<SearchHit> hits = parseQueryResponse(response);
        log.debug("Chroma returned {} hits (k={}, filter={})", hits.size(), k, filter);
        return hits;
    }

    @Override
    public long count() {
        try {
            Number count = chromaWebClient.get()
                    .uri(collectionsPath() + "/" + resolveCollectionId() + "/count")
                    .retrieve()
                    .bodyToMono(Long.class)
                    .block(timeout());
            return count != null ? count.longValue() : 0L;
        } catch (VectorIndexException e) {
            throw e;
        } catch (Exception e) {
            throw new VectorIndexException("Vector index count failed", e);
        }
    }

    @Override
    public String name() {
        return "chroma";
    }

    // ============================================================
    // Helpers
    // ============================================================

    private String resolveCollectionId() {
        String id = collectionId;
        if (id != null) {
            return id;
        }

        String collection = properties.getIndex().getCollection();
        try {
            @SuppressWarnings("unchecked")
            Map<String, Object> info = chromaWebClient.get()
                    .uri(collectionsPath() + "/" + collection)
                    .retrieve()
                    .bodyToMono(Map.class)
                    .block(timeout());

            if (info == null || info.get("id") == null) {
                throw new VectorIndexException("Collection not found: " + collection);
            }
            id = String.valueOf(info.get("id"));
        } catch (VectorIndexException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to resolve Chroma collection '{}': {}", collection, e.getMessage());
            throw new VectorIndexException("Failed to resolve collection " + collection, e);
        }

        log.info("Resolved Chroma collection '{}' -> {}", collection, id);
        collectionId = id;
        return id;
    }

    static Map<String, Object> toWhere(Map<String, String> filter) {
        if (filter == null || filter.isEmpty()) {
            return null;
        }
        List<Map<String, Object>> clauses = new ArrayList<>();
        filter.forEach((field, value) -> clauses.add(Map.of(field, Map.of("$eq", value))));
        return clauses.size() == 1 ? clauses.get(0) : Map.of("$and", clauses);
    }

    /**
     * Chroma answers batch-shaped lists (one inner list per query embedding);
     * only the first batch entry is used.
     */
    @SuppressWarnings("unchecked")
    static List<SearchHit> parseQueryResponse(Map<String, Object> response) {
        if (response == null) {
            return List.of();
        }

        List<Object> documents = firstBatch(response.get("documents"));
        if (documents.isEmpty()) {
            return List.of();
        }
        List<Object> ids = firstBatch(response.get("ids"));
        List<Object> metadatas = firstBatch(response.get("metadatas"));
        List<Object> distances = firstBatch(response.get("distances"));

        List<SearchHit> hits = new ArrayList<>(documents.size());
        for (int i = 0; i < documents.size(); i++) {
            String id = i < ids.size() ? String.valueOf(ids.get(i)) : "hit_" + i;
            String text = documents.get(i) != null ? String.valueOf(documents.get(i)) : "";
            Map<String, Object> meta = i < metadatas.size() && metadatas.get(i) instanceof Map
                    ? (Map<String, Object>) metadatas.get(i)
                    : Map.of();
            double distance = i < distances.size() && distances.get(i) instanceof Number
                    ? ((Number) distances.get(i)).doubleValue()
                    : 1.0;

            hits.add(SearchHit.of(PassageMetadataMapper.toPassage(id, text, meta), distance, "chroma"));
        }
        return hits;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> firstBatch(Object value) {
        if (!(value instanceof List) || ((List<Object>) value).isEmpty()) {
            return List.of();
        }
        Object first = ((List<Object>) value).get(0);
        return first instanceof List ? (List<Object>) first : List.of();
    }

    private String collectionsPath() {
        return properties.getIndex().getCollectionsPath();
    }

    private Duration timeout() {
        return Duration.ofSeconds(properties.getIndex().getTimeoutSeconds());
    }
}
