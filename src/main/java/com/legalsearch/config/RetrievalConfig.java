package com.legalsearch.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.Executor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.legalsearch.exception.RetrievalException;
import com.legalsearch.service.topic.TopicTable;
import com.legalsearch.service.topic.TopicTableLoader;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class RetrievalConfig {

    private final RetrievalProperties properties;

    /**
     * Topic table is read once at startup; it never changes at runtime.
     */
    @Bean
    public TopicTable topicTable(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        String location = properties.getTopics().getResource();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new RetrievalException("Topic table not found: " + location);
        }

        try (InputStream in = resource.getInputStream()) {
            return new TopicTableLoader(objectMapper).load(in, location);
        } catch (IOException e) {
            throw new RetrievalException("Failed to open topic table " + location, e);
        }
    }

    @Bean(name = "retrievalExecutor")
    public Executor retrievalExecutor() {
        RetrievalProperties.Executor config = properties.getExecutor();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getPoolSize());
        executor.setMaxPoolSize(config.getPoolSize());
        executor.setQueueCapacity(config.getQueueCapacity());
        executor.setThreadNamePrefix("retrieval-");
        executor.initialize();

        log.info("Retrieval executor: {} threads, queue {}", config.getPoolSize(), config.getQueueCapacity());
        return executor;
    }
}
