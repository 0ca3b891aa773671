package com.legalsearch.dto.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SearchRequest {

    @NotBlank
    private String query;

    // exact topic name, no filter when blank
    private String topic;

    @Min(1)
    @Max(50)
    @JsonProperty("top_k")
    @JsonAlias("topK")
    private Integer topK;
}
