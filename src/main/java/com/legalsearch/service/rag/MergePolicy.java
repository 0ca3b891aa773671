package com.legalsearch.service.rag;

import com.legalsearch.dto.internal.SearchHit;

import java.util.List;

/**
 * Combines the broad semantic result list with the topic-filtered one.
 */
public interface MergePolicy {

    /**
     * @param semantic broad unfiltered hits, index order
     * @param filtered topic-filtered hits, index order; empty when no topic search succeeded
     * @return at most {@code topK} hits
     */
    List<SearchHit> merge(List<SearchHit> semantic, List<SearchHit> filtered, int topK);
}
