package com.legalsearch.service.classify;

import com.legalsearch.dto.internal.Classification;

/**
 * Labels a raw question with a category, an intent and a deadline flag.
 * Treated as a pure function of the question text.
 */
public interface QueryClassifier {

    Classification classify(String question);
}
