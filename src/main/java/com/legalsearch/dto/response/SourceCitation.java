package com.legalsearch.dto.response;

import com.legalsearch.dto.internal.LegalPassage;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SourceCitation {

    String chapter;

    String section;

    String topic;

    String pages;

    public static SourceCitation from(LegalPassage passage) {
        return SourceCitation.builder()
                .chapter(passage.getChapter())
                .section(passage.getSection())
                .topic(passage.getTopic())
                .pages(passage.getSourcePages())
                .build();
    }
}
