package com.legalsearch.service.index;

import com.legalsearch.dto.internal.LegalPassage;

/**
 * A passage together with its precomputed embedding.
 */
public record IndexedPassage(LegalPassage passage, double[] vector) {
}
