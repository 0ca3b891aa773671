package com.legalsearch.service.rag;

import com.legalsearch.config.RetrievalProperties;
import com.legalsearch.dto.response.RetrievalResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Bounded memo of assembled retrieval results.
 *
 * <p>Keys are the searched query and the question as asked, both with surrounding
 * whitespace stripped (no case folding), plus the requested result count. A follow-up
 * whose enriched query equals a literal question still gets its own entry, since the
 * cached result carries metadata of the question as asked. Cached results are immutable
 * and are shared between callers. Eviction is strictly by insertion order: reads never promote
 * an entry. The lock covers only the map check and the map insert, never the computation.
 */
@Slf4j
@Component
public class ResultCache {

    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<CacheKey, RetrievalResult> entries = new LinkedHashMap<>();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    @Autowired
    public ResultCache(RetrievalProperties properties) {
        this(properties.getCache().getResultCapacity());
    }

    public ResultCache(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Result cache capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public RetrievalResult getOrCompute(String query, int topK, Supplier<RetrievalResult> compute) {
        return getOrCompute(query, query, topK, compute);
    }

    /**
     * @param query    string that is embedded and searched
     * @param question question as asked, before follow-up enrichment
     */
    public RetrievalResult getOrCompute(String query, String question, int topK,
                                        Supplier<RetrievalResult> compute) {
        CacheKey key = CacheKey.of(query, question, topK);

        RetrievalResult cached = get(key);
        if (cached != null) {
            hits.incrementAndGet();
            log.debug("Result cache hit: '{}'", key.query());
            return cached;
        }
        misses.incrementAndGet();

        RetrievalResult computed = compute.get();
        return put(key, computed);
    }

    public RetrievalResult get(String query, int topK) {
        return get(query, query, topK);
    }

    public RetrievalResult get(String query, String question, int topK) {
        return get(CacheKey.of(query, question, topK));
    }

    public boolean contains(String query, int topK) {
        return get(query, topK) != null;
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    private RetrievalResult get(CacheKey key) {
        lock.lock();
        try {
            return entries.get(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores the value unless a concurrent caller stored one first; returns the stored value.
     */
    private RetrievalResult put(CacheKey key, RetrievalResult value) {
        lock.lock();
        try {
            RetrievalResult existing = entries.get(key);
            if (existing != null) {
                return existing;
            }
            if (entries.size() >= capacity) {
                Iterator<CacheKey> oldest = entries.keySet().iterator();
                CacheKey evicted = oldest.next();
                oldest.remove();
                log.debug("Result cache evicted: '{}'", evicted.query());
            }
            entries.put(key, value);
            return value;
        } finally {
            lock.unlock();
        }
    }

    record CacheKey(String query, String question, int topK) {

        static CacheKey of(String query, String question, int topK) {
            return new CacheKey(strip(query), strip(question), topK);
        }

        private static String strip(String text) {
            return text == null ? "" : text.strip();
        }
    }
}
