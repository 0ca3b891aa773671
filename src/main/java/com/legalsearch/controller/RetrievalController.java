package com.legalsearch.controller;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.legalsearch.config.RetrievalProperties;
import com.legalsearch.dto.internal.SearchHit;
import com.legalsearch.dto.request.RetrieveRequest;
import com.legalsearch.dto.request.SearchRequest;
import com.legalsearch.dto.response.RetrievalResult;
import com.legalsearch.dto.response.SearchResponse;
import com.legalsearch.exception.RetrievalException;
import com.legalsearch.service.embedding.QueryEmbeddingCache;
import com.legalsearch.service.index.VectorIndex;
import com.legalsearch.service.rag.HybridRetrievalService;
import com.legalsearch.service.rag.ResultCache;
import com.legalsearch.service.topic.TopicTable;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class RetrievalController {

    private final HybridRetrievalService retrievalService;
    private final VectorIndex vectorIndex;
    private final ResultCache resultCache;
    private final QueryEmbeddingCache embeddingCache;
    private final TopicTable topicTable;
    private final RetrievalProperties properties;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        log.debug("Health check requested");

        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "healthy");
        health.put("timestamp", Instant.now().toString());
        health.put("service", "Legal Search API");
        health.put("index", vectorIndex.name());

        try {
            health.put("passages", vectorIndex.count());
        } catch (Exception e) {
            log.warn("Index count unavailable: {}", e.getMessage());
            health.put("status", "degraded");
            health.put("passages", 0);
        }

        Map<String, Object> caches = new LinkedHashMap<>();
        caches.put("results", resultCache.size());
        caches.put("result_hits", resultCache.getHits());
        caches.put("result_misses", resultCache.getMisses());
        caches.put("embeddings", embeddingCache.size());
        health.put("caches", caches);

        return ResponseEntity.ok(health);
    }

    @PostMapping("/retrieve")
    public ResponseEntity<?> retrieve(@Valid @RequestBody RetrieveRequest request) {
        log.info("Retrieve received: {}", request.getQuestion());

        try {
            RetrievalResult result = retrievalService.retrieve(
                    request.getQuestion(),
                    request.getChatHistory(),
                    request.getTopK()
            );
            return ResponseEntity.ok(result);

        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", e.getMessage()));
        } catch (RetrievalException e) {
            log.error("Retrieval failed for: {}", request.getQuestion(), e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of(
                        "error", e.getMessage(),
                        "question", request.getQuestion()
                    ));
        }
    }

    @PostMapping("/search")
    public ResponseEntity<?> search(@Valid @RequestBody SearchRequest request) {
        int topK = request.getTopK() != null
                ? request.getTopK()
                : properties.getRetrieval().getTopK();

        try {
            List<SearchHit> hits = retrievalService.search(request.getQuery(), request.getTopic(), topK);
            return ResponseEntity.ok(SearchResponse.builder()
                    .query(request.getQuery())
                    .topic(request.getTopic())
                    .results(hits)
                    .total(hits.size())
                    .build());

        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", e.getMessage()));
        } catch (RetrievalException e) {
            log.error("Search failed for: {}", request.getQuery(), e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of(
                        "error", e.getMessage(),
                        "query", request.getQuery()
                    ));
        }
    }

    @GetMapping("/topics")
    public ResponseEntity<List<String>> topics() {
        return ResponseEntity.ok(topicTable.getTopics());
    }
}
