package com.legalsearch.dto.internal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SearchHit {

    private LegalPassage passage;

    private Double distance;

    private Double score;

    private String source;  // semantic, filtered

    public static SearchHit of(LegalPassage passage, double distance, String source) {
        double similarity = Math.max(0.0, Math.min(1.0, 1.0 - distance));
        return SearchHit.builder()
                .passage(passage)
                .distance(distance)
                .score(similarity)
                .source(source)
                .build();
    }

    public String getText() {
        return passage != null && passage.getText() != null ? passage.getText() : "";
    }
}
