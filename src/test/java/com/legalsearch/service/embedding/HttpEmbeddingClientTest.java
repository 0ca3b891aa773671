package com.legalsearch.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;

import com.legalsearch.config.RetrievalProperties;
import com.legalsearch.exception.EmbeddingException;

import reactor.core.publisher.Mono;

class HttpEmbeddingClientTest {

    private final RetrievalProperties properties = new RetrievalProperties();

    @Test
    void embedsThroughEmbedEndpoint() {
        HttpEmbeddingClient client = new HttpEmbeddingClient(properties,
                stubClient(HttpStatus.OK, "{\"embeddings\": [[0.25, -0.5, 1]]}"));

        assertThat(client.embedQuery("ما عدة الحامل؟")).containsExactly(0.25, -0.5, 1.0);
        assertThat(client.name()).isEqualTo("http");
    }

    @Test
    void serviceErrorBecomesEmbeddingException() {
        HttpEmbeddingClient client = new HttpEmbeddingClient(properties,
                stubClient(HttpStatus.INTERNAL_SERVER_ERROR, "{}"));

        assertThatThrownBy(() -> client.embedQuery("سؤال"))
                .isInstanceOf(EmbeddingException.class)
                .hasMessageContaining("Failed to generate embedding");
    }

    @Test
    void blankTextIsRejected() {
        HttpEmbeddingClient client = new HttpEmbeddingClient(properties, WebClient.create());

        assertThatThrownBy(() -> client.embedQuery("  ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void malformedResponses() {
        HttpEmbeddingClient client = new HttpEmbeddingClient(properties, WebClient.create());

        assertThatThrownBy(() -> client.firstVector(null)).isInstanceOf(EmbeddingException.class);
        assertThatThrownBy(() -> client.firstVector(Map.of("vectors", List.of())))
                .isInstanceOf(EmbeddingException.class);
        assertThatThrownBy(() -> client.firstVector(Map.of("embeddings", List.of())))
                .isInstanceOf(EmbeddingException.class);
        assertThatThrownBy(() -> client.firstVector(Map.of("embeddings", List.of(List.of("x")))))
                .isInstanceOf(EmbeddingException.class);
    }

    private static WebClient stubClient(HttpStatus status, String body) {
        return WebClient.builder()
                .exchangeFunction(request -> Mono.just(ClientResponse.create(status)
                        .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                        .body(body)
                        .build()))
                .build();
    }
}
