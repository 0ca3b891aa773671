package com.legalsearch.config;

import java.time.Duration;

import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.ollama.OllamaEmbeddingModel;
import org.springframework.ai.ollama.api.OllamaApi;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.netty.http.client.HttpClient;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class EmbeddingConfig {

    private final RetrievalProperties properties;

    @Bean
    public WebClient embeddingWebClient() {
        RetrievalProperties.Embedding embedding = properties.getEmbedding();

        log.info("==============================================");
        log.info("EMBEDDING PROVIDER CONFIGURATION");
        log.info("==============================================");
        log.info("  Provider  : {}", embedding.getProvider());
        log.info("  Base URL  : {}", embedding.getBaseUrl());
        log.info("  Dimension : {}", embedding.getDimension());
        log.info("  Timeout   : {}s", embedding.getTimeoutSeconds());
        log.info("==============================================");

        return WebClient.builder()
                .baseUrl(embedding.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(
                        HttpClient.create()
                                .responseTimeout(Duration.ofSeconds(embedding.getTimeoutSeconds()))
                ))
                .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "legal-search.embedding", name = "provider", havingValue = "ollama")
    public EmbeddingModel ollamaEmbeddingModel() {
        RetrievalProperties.Embedding embedding = properties.getEmbedding();
        log.info("Initializing Ollama embedding model '{}' at {}", embedding.getOllamaModel(), embedding.getBaseUrl());

        OllamaApi ollamaApi = OllamaApi.builder()
                .baseUrl(embedding.getBaseUrl())
                .build();

        return OllamaEmbeddingModel.builder()
                .ollamaApi(ollamaApi)
                .defaultOptions(OllamaOptions.builder()
                        .model(embedding.getOllamaModel())
                        .build())
                .build();
    }
}
