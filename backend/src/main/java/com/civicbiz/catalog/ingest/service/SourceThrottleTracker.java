package com.civicbiz.catalog.ingest.service;

import com.civicbiz.catalog.ingest.http.SourceRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Run-scoped record of throttling signals. Each signal pushes the source's rate limiter further
 * out; a source that keeps signalling is switched off for the rest of the run.
 */
public class SourceThrottleTracker {
    private static final Logger log = LoggerFactory.getLogger(SourceThrottleTracker.class);

    private final SourceRateLimiter rateLimiter;
    private final long backoffSeconds;
    private final int disableAfterSignals;
    private final Map<String, AtomicInteger> signals = new ConcurrentHashMap<>();
    private final Set<String> disabled = ConcurrentHashMap.newKeySet();

    public SourceThrottleTracker(SourceRateLimiter rateLimiter, long backoffSeconds, int disableAfterSignals) {
        this.rateLimiter = rateLimiter;
        this.backoffSeconds = Math.max(0, backoffSeconds);
        this.disableAfterSignals = Math.max(1, disableAfterSignals);
    }

    /** Returns true when this signal disabled the source. */
    public boolean recordSignal(String sourceId) {
        String key = key(sourceId);
        int count = signals.computeIfAbsent(key, ignored -> new AtomicInteger()).incrementAndGet();
        if (rateLimiter != null && backoffSeconds > 0) {
            rateLimiter.extendBackoff(key, Duration.ofSeconds(backoffSeconds * count));
        }
        if (count >= disableAfterSignals && disabled.add(key)) {
            log.warn("Disabling source {} for the rest of the run after {} rate-limit signals", key, count);
            return true;
        }
        return false;
    }

    public boolean isDisabled(String sourceId) {
        return disabled.contains(key(sourceId));
    }

    int signalCount(String sourceId) {
        AtomicInteger count = signals.get(key(sourceId));
        return count == null ? 0 : count.get();
    }

    public List<String> disabledSources() {
        return disabled.stream().sorted().toList();
    }

    private String key(String sourceId) {
        return sourceId == null ? "default" : sourceId.toLowerCase(Locale.ROOT);
    }
}
