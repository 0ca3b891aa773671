package com.legalsearch.service.monitoring;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Per-request step timer. Not thread-safe: one instance per retrieval.
 */
public class RetrievalTimer {

    private long startNanos = -1L;
    private long lastNanos;
    private long endNanos = -1L;

    private final Map<String, Long> stepNanos = new LinkedHashMap<>();

    public void start() {
        startNanos = System.nanoTime();
        lastNanos = startNanos;
        endNanos = -1L;
        stepNanos.clear();
    }

    /**
     * Closes the current step under the given name; repeated names accumulate.
     */
    public void mark(String step) {
        if (startNanos < 0) {
            start();
        }
        long now = System.nanoTime();
        stepNanos.merge(step, now - lastNanos, Long::sum);
        lastNanos = now;
    }

    public void end() {
        endNanos = System.nanoTime();
    }

    public long getTotalMillis() {
        if (startNanos < 0 || endNanos < 0) {
            return 0L;
        }
        return TimeUnit.NANOSECONDS.toMillis(endNanos - startNanos);
    }

    public Map<String, Long> getStepMillis() {
        Map<String, Long> millis = new LinkedHashMap<>();
        stepNanos.forEach((step, nanos) -> millis.put(step, TimeUnit.NANOSECONDS.toMillis(nanos)));
        return millis;
    }

    public String summary() {
        StringBuilder sb = new StringBuilder("total=").append(getTotalMillis()).append("ms");
        getStepMillis().forEach((step, ms) -> sb.append(", ").append(step).append('=').append(ms).append("ms"));
        return sb.toString();
    }
}
