package com.legalsearch.dto.response;

import com.legalsearch.dto.internal.SearchHit;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponse {

    private String query;

    private String topic;

    private List<SearchHit> results;

    private int total;
}
