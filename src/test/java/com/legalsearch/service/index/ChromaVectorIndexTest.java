package com.legalsearch.service.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;

import com.legalsearch.config.RetrievalProperties;
import com.legalsearch.dto.internal.LegalPassage;
import com.legalsearch.dto.internal.SearchHit;
import com.legalsearch.exception.VectorIndexException;

import reactor.core.publisher.Mono;

class ChromaVectorIndexTest {

    private static final String QUERY_RESPONSE = "{"
            + "\"ids\": [[\"c1\", \"c2\"]],"
            + "\"documents\": [[\"عدة الحامل وضع الحمل.\", \"تعتد المتوفى عنها أربعة أشهر وعشرا.\"]],"
            + "\"metadatas\": [[{\"topic\": \"العدة\", \"section\": \"العدة\", \"has_deadline\": \"True\","
            + "   \"deadline_details\": \"حتى وضع الحمل\"}, {\"topic\": \"العدة\"}]],"
            + "\"distances\": [[0.12, 0.3]]"
            + "}";

    private RetrievalProperties properties;
    private List<String> requests;

    @BeforeEach
    void setUp() {
        properties = new RetrievalProperties();
        requests = new ArrayList<>();
    }

    @Test
    void queriesResolvedCollection() {
        ChromaVectorIndex index = new ChromaVectorIndex(properties, stubClient(HttpStatus.OK));

        List<SearchHit> hits = index.search(List.of(0.1, 0.2), 5, Map.of("topic", "العدة"));
        index.search(List.of(0.1, 0.2), 5);

        assertThat(hits).hasSize(2);
        assertThat(hits.get(0).getPassage().isHasDeadline()).isTrue();
        assertThat(hits.get(0).getPassage().getDeadlineDetail()).isEqualTo("حتى وضع الحمل");
        assertThat(hits.get(0).getScore()).isEqualTo(0.88, within(1e-9));

        String collections = properties.getIndex().getCollectionsPath();
        assertThat(requests).containsExactly(
                "GET " + collections + "/saudi_family_law",
                "POST " + collections + "/col-1/query",
                "POST " + collections + "/col-1/query");
    }

    @Test
    void countUsesCountEndpoint() {
        ChromaVectorIndex index = new ChromaVectorIndex(properties, stubClient(HttpStatus.OK));

        assertThat(index.count()).isEqualTo(42L);
    }

    @Test
    void transportFailureBecomesIndexException() {
        ChromaVectorIndex index = new ChromaVectorIndex(properties, stubClient(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> index.search(List.of(0.1), 5))
                .isInstanceOf(VectorIndexException.class);
    }

    @Test
    void whereClause() {
        assertThat(ChromaVectorIndex.toWhere(Map.of())).isNull();
        assertThat(ChromaVectorIndex.toWhere(Map.of("topic", "النفقة")))
                .isEqualTo(Map.of("topic", Map.of("$eq", "النفقة")));
        assertThat(ChromaVectorIndex.toWhere(Map.of("topic", "النفقة", "law", "نظام الأحوال الشخصية")))
                .containsOnlyKeys("$and");
    }

    @Test
    void parsesFirstBatchOnly() {
        Map<String, Object> response = Map.of(
                "ids", List.of(List.of("a"), List.of("b")),
                "documents", List.of(List.of("نص"), List.of("آخر")),
                "metadatas", List.of(List.of(Map.of("topic_tags", "العدة, النفقة"))),
                "distances", List.of(List.of(0.25)));

        List<SearchHit> hits = ChromaVectorIndex.parseQueryResponse(response);

        assertThat(hits).hasSize(1);
        LegalPassage passage = hits.get(0).getPassage();
        assertThat(passage.getId()).isEqualTo("a");
        assertThat(passage.getTopicTags()).containsExactly("العدة", "النفقة");
        assertThat(hits.get(0).getSource()).isEqualTo("chroma");
    }

    @Test
    void emptyResponse() {
        assertThat(ChromaVectorIndex.parseQueryResponse(null)).isEmpty();
        assertThat(ChromaVectorIndex.parseQueryResponse(Map.of("documents", List.of(List.of())))).isEmpty();
    }

    private WebClient stubClient(HttpStatus status) {
        return WebClient.builder()
                .exchangeFunction(request -> {
                    String path = request.url().getPath();
                    requests.add(request.method().name() + " " + path);

                    if (status != HttpStatus.OK) {
                        return Mono.just(ClientResponse.create(status).build());
                    }
                    String body;
                    if (HttpMethod.GET.equals(request.method()) && path.endsWith("/count")) {
                        body = "42";
                    } else if (HttpMethod.GET.equals(request.method())) {
                        body = "{\"id\": \"col-1\", \"name\": \"saudi_family_law\"}";
                    } else {
                        body = QUERY_RESPONSE;
                    }
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
    }
}
