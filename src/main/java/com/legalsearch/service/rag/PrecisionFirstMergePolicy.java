package com.legalsearch.service.rag;

import com.legalsearch.config.RetrievalProperties;
import com.legalsearch.dto.internal.SearchHit;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Topic-filtered hits always rank above semantic-only hits, whatever their scores.
 * Each list keeps the order the index returned; scores are never compared across lists.
 * Hits sharing the same opening characters are treated as the same passage.
 */
@Component
public class PrecisionFirstMergePolicy implements MergePolicy {

    private final int dedupPrefixChars;

    @Autowired
    public PrecisionFirstMergePolicy(RetrievalProperties properties) {
        this(properties.getRetrieval().getDedupPrefixChars());
    }

    public PrecisionFirstMergePolicy(int dedupPrefixChars) {
        if (dedupPrefixChars < 1) {
            throw new IllegalArgumentException("Dedup prefix must be positive: " + dedupPrefixChars);
        }
        this.dedupPrefixChars = dedupPrefixChars;
    }

    @Override
    public List<SearchHit> merge(List<SearchHit> semantic, List<SearchHit> filtered, int topK) {
        List<SearchHit> broad = semantic != null ? semantic : List.of();

        if (filtered == null || filtered.isEmpty()) {
            return List.copyOf(broad.subList(0, Math.min(topK, broad.size())));
        }

        Set<String> seen = new HashSet<>();
        List<SearchHit> merged = new ArrayList<>(topK);

        appendUnseen(filtered, seen, merged, topK);
        appendUnseen(broad, seen, merged, topK);

        return List.copyOf(merged);
    }

    private void appendUnseen(List<SearchHit> hits, Set<String> seen, List<SearchHit> merged, int topK) {
        for (SearchHit hit : hits) {
            if (merged.size() >= topK) {
                return;
            }
            if (seen.add(dedupKey(hit))) {
                merged.add(hit);
            }
        }
    }

    String dedupKey(SearchHit hit) {
        String text = hit.getText();
        return text.length() > dedupPrefixChars ? text.substring(0, dedupPrefixChars) : text;
    }
}
