package com.legalsearch.dto.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.*;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RetrieveRequest {

    @NotBlank
    private String question;

    @JsonProperty("chat_history")
    @JsonAlias("chatHistory")
    private List<ChatTurn> chatHistory;

    @Min(1)
    @Max(50)
    @JsonProperty("top_k")
    @JsonAlias("topK")
    private Integer topK;
}
