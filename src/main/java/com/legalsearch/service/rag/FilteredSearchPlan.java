package com.legalsearch.service.rag;

import com.legalsearch.dto.internal.SearchHit;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Ordered topic-filtered searches: first candidate topic, then the second. The plan
 * stops at the first step that returns any hit; filters are never OR-ed together.
 * When no step succeeds the caller falls back to semantic results alone.
 */
public final class FilteredSearchPlan {

    private final List<String> topics;

    private FilteredSearchPlan(List<String> topics) {
        this.topics = List.copyOf(topics);
    }

    public static FilteredSearchPlan of(List<String> candidateTopics, int maxSteps) {
        if (candidateTopics == null || candidateTopics.isEmpty() || maxSteps < 1) {
            return new FilteredSearchPlan(List.of());
        }
        return new FilteredSearchPlan(candidateTopics.subList(0, Math.min(maxSteps, candidateTopics.size())));
    }

    public List<String> getTopics() {
        return topics;
    }

    public boolean isEmpty() {
        return topics.isEmpty();
    }

    /**
     * Runs the steps in order with the given topic-filtered search.
     */
    public Outcome execute(Function<String, List<SearchHit>> filteredSearch) {
        List<String> attempted = new ArrayList<>(topics.size());
        for (String topic : topics) {
            attempted.add(topic);
            List<SearchHit> hits = filteredSearch.apply(topic);
            if (hits != null && !hits.isEmpty()) {
                return new Outcome(topic, List.copyOf(hits), List.copyOf(attempted));
            }
        }
        return new Outcome(null, List.of(), List.copyOf(attempted));
    }

    /**
     * @param topic     topic whose filtered search succeeded, null when none did
     * @param hits      hits of that search, empty when none did
     * @param attempted topics searched, in order
     */
    public record Outcome(String topic, List<SearchHit> hits, List<String> attempted) {

        public static Outcome none() {
            return new Outcome(null, List.of(), List.of());
        }

        public boolean matched() {
            return topic != null;
        }
    }
}
