package com.legalsearch.dto.internal;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * A chunk of statute text with its topical metadata. Built by the corpus side,
 * never mutated by retrieval.
 */
@Value
@Builder(toBuilder = true)
public class LegalPassage {

    String id;

    String text;

    @Builder.Default
    String law = "";

    @Builder.Default
    String chapter = "";

    @Builder.Default
    String section = "";

    @Builder.Default
    String topic = "";

    @Builder.Default
    Set<String> topicTags = Set.of();

    boolean hasDeadline;

    @Builder.Default
    String deadlineDetail = "";

    @Builder.Default
    String sourcePages = "";
}
