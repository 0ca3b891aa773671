package com.legalsearch.service.rag;

import com.legalsearch.config.RetrievalProperties;
import com.legalsearch.dto.internal.Classification;
import com.legalsearch.dto.internal.SearchHit;
import com.legalsearch.dto.request.ChatTurn;
import com.legalsearch.dto.response.RetrievalResult;
import com.legalsearch.exception.RetrievalException;
import com.legalsearch.service.classify.QueryClassifier;
import com.legalsearch.service.embedding.QueryEmbeddingCache;
import com.legalsearch.service.enrich.QueryEnricher;
import com.legalsearch.service.index.PassageMetadataMapper;
import com.legalsearch.service.index.VectorIndex;
import com.legalsearch.service.monitoring.RetrievalTimer;
import com.legalsearch.service.topic.TopicDetector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Hybrid statute retrieval: topic-filtered search for precision, broad semantic search
 * for recall, merged and rendered into a bounded grounding context.
 *
 * <p>Upstream failures (embedding provider, vector index) propagate unchanged and
 * nothing is cached for them. Zero hits is a normal result.
 */
@Slf4j
@Service
public class HybridRetrievalService {

    private final QueryEnricher queryEnricher;
    private final TopicDetector topicDetector;
    private final QueryClassifier queryClassifier;
    private final QueryEmbeddingCache embeddingCache;
    private final VectorIndex vectorIndex;
    private final MergePolicy mergePolicy;
    private final ContextAssembler contextAssembler;
    private final ResultCache resultCache;
    private final RetrievalProperties properties;
    private final Executor retrievalExecutor;

    public HybridRetrievalService(QueryEnricher queryEnricher,
                                  TopicDetector topicDetector,
                                  QueryClassifier queryClassifier,
                                  QueryEmbeddingCache embeddingCache,
                                  VectorIndex vectorIndex,
                                  MergePolicy mergePolicy,
                                  ContextAssembler contextAssembler,
                                  ResultCache resultCache,
                                  RetrievalProperties properties,
                                  @Qualifier("retrievalExecutor") Executor retrievalExecutor) {
        this.queryEnricher = queryEnricher;
        this.topicDetector = topicDetector;
        this.queryClassifier = queryClassifier;
        this.embeddingCache = embeddingCache;
        this.vectorIndex = vectorIndex;
        this.mergePolicy = mergePolicy;
        this.contextAssembler = contextAssembler;
        this.resultCache = resultCache;
        this.properties = properties;
        this.retrievalExecutor = retrievalExecutor;
    }

    public RetrievalResult retrieve(String question) {
        return retrieve(question, null, null);
    }

    /**
     * @param chatHistory prior turns, oldest first; may be null
     * @param topK        result bound, configured default when null
     */
    public RetrievalResult retrieve(String question, List<ChatTurn> chatHistory, Integer topK) {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("Question must not be blank");
        }
        int k = topK != null ? topK : properties.getRetrieval().getTopK();
        if (k < 1) {
            throw new IllegalArgumentException("topK must be positive: " + k);
        }

        String searchQuery = queryEnricher.enrich(question, chatHistory);

        // classification and topics come from the question as asked, so it is part of the key
        return resultCache.getOrCompute(searchQuery, question, k, () -> compute(question, searchQuery, k));
    }

    /**
     * Plain semantic search, optionally restricted to one exact topic.
     */
    public List<SearchHit> search(String query, String topic, int topK) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query must not be blank");
        }
        List<Double> vector = embeddingCache.embed(query);
        Map<String, String> filter = topic == null || topic.isBlank()
                ? Map.of()
                : Map.of(PassageMetadataMapper.TOPIC, topic);
        return vectorIndex.search(vector, topK, filter);
    }

    // ============================================================
    // Pipeline
    // ============================================================

    private RetrievalResult compute(String question, String searchQuery, int k) {
        RetrievalTimer timer = new RetrievalTimer();
        timer.start();

        Classification classification = queryClassifier.classify(question);
        List<String> detectedTopics = topicDetector.detectTopics(question);
        timer.mark("Classification");

        List<Double> vector = embeddingCache.embed(searchQuery);
        timer.mark("Embedding");

        FilteredSearchPlan plan = FilteredSearchPlan.of(
                topicDetector.detectTopics(searchQuery),
                properties.getRetrieval().getMaxFilterTopics());

        CompletableFuture<List<SearchHit>> semanticFuture = CompletableFuture.supplyAsync(
                () -> vectorIndex.search(vector, k * 2, Map.of()), retrievalExecutor);

        CompletableFuture<FilteredSearchPlan.Outcome> filteredFuture = plan.isEmpty()
                ? CompletableFuture.completedFuture(FilteredSearchPlan.Outcome.none())
                : CompletableFuture.supplyAsync(
                        () -> plan.execute(topic -> vectorIndex.search(
                                vector, k, Map.of(PassageMetadataMapper.TOPIC, topic))),
                        retrievalExecutor);

        List<SearchHit> semantic = tag(await(semanticFuture), "semantic");
        FilteredSearchPlan.Outcome outcome = await(filteredFuture);
        timer.mark("Vector Search");

        List<SearchHit> merged = mergePolicy.merge(semantic, tag(outcome.hits(), "filtered"), k);
        timer.mark("Merge");

        String context = contextAssembler.buildContext(merged);
        timer.mark("Context");
        timer.end();

        log.info("Retrieved {} passages for '{}' (filtered topic: {}, attempted: {})",
                merged.size(), abbreviate(searchQuery), outcome.topic(), outcome.attempted());
        log.debug("Retrieval timing: {}", timer.summary());

        return RetrievalResult.builder()
                .classification(classification)
                .context(context)
                .sources(contextAssembler.extractSources(merged))
                .numResults(merged.size())
                .detectedTopics(detectedTopics)
                .searchQuery(searchQuery)
                .build();
    }

    private static List<SearchHit> tag(List<SearchHit> hits, String source) {
        if (hits == null || hits.isEmpty()) {
            return List.of();
        }
        return hits.stream()
                .map(hit -> hit.toBuilder().source(source).build())
                .toList();
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new RetrievalException("Retrieval step failed", cause);
        }
    }

    private static String abbreviate(String text) {
        return text.length() > 60 ? text.substring(0, 60) + "..." : text;
    }
}
