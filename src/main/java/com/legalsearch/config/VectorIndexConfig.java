package com.legalsearch.config;

import java.nio.file.Path;
import java.time.Duration;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.legalsearch.service.data.PassageCorpusLoader;
import com.legalsearch.service.index.InMemoryVectorIndex;
import com.legalsearch.service.index.VectorIndex;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.netty.http.client.HttpClient;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class VectorIndexConfig {

    private final RetrievalProperties properties;

    @Bean
    @ConditionalOnProperty(prefix = "legal-search.index", name = "type", havingValue = "chroma", matchIfMissing = true)
    public WebClient chromaWebClient() {
        RetrievalProperties.Index index = properties.getIndex();

        log.info("==============================================");
        log.info("VECTOR INDEX CONFIGURATION");
        log.info("==============================================");
        log.info("  Type       : chroma");
        log.info("  Base URL   : {}", index.getBaseUrl());
        log.info("  Collection : {}", index.getCollection());
        log.info("==============================================");

        return WebClient.builder()
                .baseUrl(index.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(
                        HttpClient.create()
                                .responseTimeout(Duration.ofSeconds(index.getTimeoutSeconds()))
                ))
                .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "legal-search.index", name = "type", havingValue = "in-memory")
    public VectorIndex inMemoryVectorIndex(ObjectMapper objectMapper) {
        String corpusPath = properties.getIndex().getCorpusPath();
        log.info("Vector index type: in-memory (corpus {})", corpusPath);

        PassageCorpusLoader loader = new PassageCorpusLoader(objectMapper);
        return new InMemoryVectorIndex(loader.load(Path.of(corpusPath)));
    }
}
