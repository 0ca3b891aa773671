package com.legalsearch.service.embedding;

import com.legalsearch.config.RetrievalProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide memo of query vectors keyed by the raw query text, least recently
 * used entries evicted first. The provider is always called outside the lock.
 */
@Slf4j
@Service
public class QueryEmbeddingCache {

    private final EmbeddingProvider provider;
    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, List<Double>> entries;

    @Autowired
    public QueryEmbeddingCache(EmbeddingProvider provider, RetrievalProperties properties) {
        this(provider, properties.getCache().getEmbeddingCapacity());
    }

    public QueryEmbeddingCache(EmbeddingProvider provider, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Embedding cache capacity must be positive: " + capacity);
        }
        this.provider = provider;
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(16, 0.75f, true);
    }

    public List<Double> embed(String query) {
        lock.lock();
        try {
            List<Double> cached = entries.get(query);
            if (cached != null) {
                return cached;
            }
        } finally {
            lock.unlock();
        }

        List<Double> vector = List.copyOf(provider.embedQuery(query));

        lock.lock();
        try {
            List<Double> raced = entries.get(query);
            if (raced != null) {
                return raced;
            }
            if (entries.size() >= capacity) {
                String eldest = entries.keySet().iterator().next();
                entries.remove(eldest);
            }
            entries.put(query, vector);
        } finally {
            lock.unlock();
        }

        log.debug("Embedded query via {} ({} dims)", provider.name(), vector.size());
        return vector;
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }
}
