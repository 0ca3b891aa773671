package com.legalsearch.service.index;

import com.legalsearch.dto.internal.SearchHit;

import java.util.List;
import java.util.Map;

/**
 * Approximate nearest-neighbour search over passage vectors.
 *
 * <p>Hits come back most similar first. An empty list is a valid outcome;
 * transport and auth failures throw {@link com.legalsearch.exception.VectorIndexException}.
 */
public interface VectorIndex {

    /**
     * @param filter metadata equality constraints (field to value), empty for none
     */
    List<SearchHit> search(List<Double> vector, int k, Map<String, String> filter);

    default List<SearchHit> search(List<Double> vector, int k) {
        return search(vector, k, Map.of());
    }

    long count();

    String name();
}
