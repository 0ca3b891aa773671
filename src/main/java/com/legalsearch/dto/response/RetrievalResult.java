package com.legalsearch.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.legalsearch.dto.internal.Classification;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RetrievalResult {

    Classification classification;

    /**
     * Grounding block for the answer generator. Never empty: a search that found
     * nothing carries an explicit marker instead.
     */
    String context;

    List<SourceCitation> sources;

    @JsonProperty("num_results")
    int numResults;

    // ================= CALLER METADATA =================

    /**
     * Topics detected on the question as asked (before follow-up enrichment)
     */
    @JsonProperty("detected_topics")
    List<String> detectedTopics;

    /**
     * Query string actually embedded and searched, possibly enriched
     */
    @JsonProperty("search_query")
    String searchQuery;
}
