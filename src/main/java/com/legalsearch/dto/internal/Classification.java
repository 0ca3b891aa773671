package com.legalsearch.dto.internal;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Classification {

    String category;

    String intent;

    @JsonProperty("needs_deadline_check")
    boolean needsDeadlineCheck;
}
