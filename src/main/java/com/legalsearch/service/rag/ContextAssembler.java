package com.legalsearch.service.rag;

import com.legalsearch.config.RetrievalProperties;
import com.legalsearch.dto.internal.LegalPassage;
import com.legalsearch.dto.internal.SearchHit;
import com.legalsearch.dto.response.SourceCitation;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders merged hits as a grounding block for the answer generator, and the matching
 * citation list.
 */
@Component
@RequiredArgsConstructor
public class ContextAssembler {

    public static final String NO_RESULTS_MARKER = "لم يتم العثور على مواد ذات صلة.";
    public static final String DEADLINE_PREFIX = "⏰ مهلة: ";
    static final String TRUNCATION_MARK = "…";

    private final RetrievalProperties properties;

    /**
     * One block per hit: ordinal and source label, passage text, deadline line when
     * the passage carries one. Output never exceeds the configured character budget.
     */
    public String buildContext(List<SearchHit> hits) {
        if (hits == null || hits.isEmpty()) {
            return NO_RESULTS_MARKER;
        }

        int budget = properties.getContext().getMaxChars();
        StringBuilder context = new StringBuilder();

        for (int i = 0; i < hits.size(); i++) {
            String block = renderBlock(i + 1, hits.get(i).getPassage());

            if (context.length() + block.length() <= budget) {
                context.append(block);
                continue;
            }

            int remaining = budget - context.length() - TRUNCATION_MARK.length();
            if (remaining > 0) {
                context.append(block, 0, remaining).append(TRUNCATION_MARK);
            }
            break;
        }

        return context.toString().stripTrailing();
    }

    /**
     * Citations in hit order, independent of what fit in the context budget.
     */
    public List<SourceCitation> extractSources(List<SearchHit> hits) {
        if (hits == null || hits.isEmpty()) {
            return List.of();
        }
        List<SourceCitation> sources = new ArrayList<>(hits.size());
        for (SearchHit hit : hits) {
            if (hit.getPassage() != null) {
                sources.add(SourceCitation.from(hit.getPassage()));
            }
        }
        return List.copyOf(sources);
    }

    private String renderBlock(int ordinal, LegalPassage passage) {
        StringBuilder block = new StringBuilder();
        block.append('[').append(ordinal).append("] ").append(label(passage)).append('\n');
        block.append(passage.getText()).append('\n');
        if (passage.isHasDeadline()) {
            block.append(DEADLINE_PREFIX).append(passage.getDeadlineDetail()).append('\n');
        }
        block.append('\n');
        return block.toString();
    }

    /**
     * Non-default law name, then section (chapter when the section is blank); the default
     * law name only when neither is present.
     */
    String label(LegalPassage passage) {
        String defaultLaw = properties.getContext().getDefaultLawName();
        List<String> parts = new ArrayList<>(2);

        String law = passage.getLaw();
        if (law != null && !law.isBlank() && !law.equals(defaultLaw)) {
            parts.add(law);
        }

        String place = passage.getSection() != null && !passage.getSection().isBlank()
                ? passage.getSection()
                : passage.getChapter();
        if (place != null && !place.isBlank()) {
            parts.add(place);
        }

        return parts.isEmpty() ? defaultLaw : String.join(" | ", parts);
    }
}
