package com.legalsearch.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Retrieval pipeline configuration, bound from the {@code legal-search} prefix.
 */
@Slf4j
@Data
@Configuration
@ConfigurationProperties(prefix = "legal-search")
public class RetrievalProperties {

    private Retrieval retrieval = new Retrieval();
    private Enrichment enrichment = new Enrichment();
    private Context context = new Context();
    private Cache cache = new Cache();
    private Embedding embedding = new Embedding();
    private Index index = new Index();
    private Topics topics = new Topics();
    private Executor executor = new Executor();

    // ============================================================
    // Retrieval
    // ============================================================
    @Data
    public static class Retrieval {
        private int topK = 5;
        private int maxFilterTopics = 2;
        private int dedupPrefixChars = 100;
    }

    // ============================================================
    // Follow-up enrichment
    // ============================================================
    @Data
    public static class Enrichment {
        private int maxUserTurns = 3;
        private int maxTopics = 2;
    }

    // ============================================================
    // Context assembly
    // ============================================================
    @Data
    public static class Context {
        private int maxChars = 12000;
        private String defaultLawName = "نظام الأحوال الشخصية";
    }

    // ============================================================
    // In-process caches
    // ============================================================
    @Data
    public static class Cache {
        private int resultCapacity = 32;
        private int embeddingCapacity = 128;
    }

    // ============================================================
    // Embedding provider
    // ============================================================
    @Data
    public static class Embedding {
        /**
         * http (Python /embed service) or ollama
         */
        private String provider = "http";
        private String baseUrl = "http://localhost:8000";
        private Integer dimension = 384;
        private Integer timeoutSeconds = 60;
        private String ollamaModel = "nomic-embed-text";
    }

    // ============================================================
    // Vector index
    // ============================================================
    @Data
    public static class Index {
        /**
         * chroma or in-memory
         */
        private String type = "chroma";
        private String baseUrl = "http://localhost:8001";
        private String collectionsPath = "/api/v2/tenants/default_tenant/databases/default_database/collections";
        private String collection = "saudi_family_law";
        private String corpusPath = "data/passages.json";
        private Integer timeoutSeconds = 30;
    }

    @Data
    public static class Topics {
        private String resource = "classpath:legal-topics.json";
    }

    @Data
    public static class Executor {
        private int poolSize = 8;
        private int queueCapacity = 200;
    }

    @PostConstruct
    public void init() {
        log.info("=".repeat(70));
        log.info("RETRIEVAL CONFIGURATION");
        log.info("=".repeat(70));
        log.info("  Default TopK        : {}", retrieval.getTopK());
        log.info("  Filter topics       : {}", retrieval.getMaxFilterTopics());
        log.info("  Context max chars   : {}", context.getMaxChars());
        log.info("  Result cache        : {}", cache.getResultCapacity());
        log.info("  Embedding cache     : {}", cache.getEmbeddingCapacity());
        log.info("  Embedding provider  : {}", embedding.getProvider());
        log.info("  Vector index        : {}", index.getType());
        log.info("=".repeat(70));
    }
}
