package com.legalsearch.service.topic;

/**
 * One surface form of a legal term and the canonical topic it maps to.
 *
 * @param term      surface form as it appears in questions
 * @param topic     canonical topic, identical to the passage metadata value
 * @param wholeWord short ambiguous form, matched only as a separate token
 * @param variant   definite-article toggled form tried when {@code term} is absent,
 *                  or null when the toggle would land on an ambiguous form
 */
public record TopicTerm(String term, String topic, boolean wholeWord, String variant) {

    public TopicTerm {
        if (term == null || term.isBlank()) {
            throw new IllegalArgumentException("Topic term must not be blank");
        }
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("Topic for term '" + term + "' must not be blank");
        }
        if (wholeWord) {
            variant = null;
        }
    }

    public int length() {
        return term.length();
    }
}
