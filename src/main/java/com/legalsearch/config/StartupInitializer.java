package com.legalsearch.config;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import com.legalsearch.service.embedding.EmbeddingProvider;
import com.legalsearch.service.index.VectorIndex;
import com.legalsearch.service.topic.TopicTable;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInitializer implements ApplicationRunner {

    private final VectorIndex vectorIndex;
    private final EmbeddingProvider embeddingProvider;
    private final TopicTable topicTable;

    @Override
    public void run(ApplicationArguments args) {
        log.info("\n{}", "=".repeat(70));
        log.info("INITIALIZING LEGAL SEARCH");
        log.info("{}\n", "=".repeat(70));

        log.info("Topic table     : {} entries, {} topics", topicTable.size(), topicTable.getTopics().size());
        log.info("Embedding       : {}", embeddingProvider.name());

        try {
            long count = vectorIndex.count();
            log.info("Vector index    : {} ({} passages)", vectorIndex.name(), count);

            log.info("\n{}", "=".repeat(70));
            log.info("SYSTEM READY");
            log.info("{}\n", "=".repeat(70));

        } catch (Exception e) {
            // index may come up after this service; requests fail until it does
            log.error("Vector index '{}' not reachable at startup: {}", vectorIndex.name(), e.getMessage());
            log.warn("Application started but retrieval will fail until the index is available");
        }
    }
}
