package com.civicbiz.catalog.ingest.http;

import com.civicbiz.catalog.config.PipelineProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Minimum spacing between calls to the same source. Each source has its own lock, so a slow
 * source never holds up another one.
 */
@Component
public class SourceRateLimiter {
    private final PipelineProperties properties;
    private final Map<String, Object> sourceLocks = new ConcurrentHashMap<>();
    private final Map<String, Instant> sourceNextAllowed = new ConcurrentHashMap<>();

    public SourceRateLimiter(PipelineProperties properties) {
        this.properties = properties;
    }

    public void acquire(String sourceId) throws InterruptedException {
        String key = normalize(sourceId);
        Object lock = sourceLocks.computeIfAbsent(key, ignored -> new Object());
        synchronized (lock) {
            Instant now = Instant.now();
            Instant allowedAt = sourceNextAllowed.getOrDefault(key, now);
            if (allowedAt.isAfter(now)) {
                long sleepMs = Duration.between(now, allowedAt).toMillis();
                if (sleepMs > 0) {
                    Thread.sleep(sleepMs);
                }
            }
            sourceNextAllowed.put(key, Instant.now().plusMillis(properties.minIntervalMs(key)));
        }
    }

    public void extendBackoff(String sourceId, Duration duration) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            return;
        }
        String key = normalize(sourceId);
        Object lock = sourceLocks.computeIfAbsent(key, ignored -> new Object());
        synchronized (lock) {
            Instant candidate = Instant.now().plus(duration);
            Instant current = sourceNextAllowed.getOrDefault(key, Instant.now());
            if (candidate.isAfter(current)) {
                sourceNextAllowed.put(key, candidate);
            }
        }
    }

    Instant nextAllowedAt(String sourceId) {
        return sourceNextAllowed.get(normalize(sourceId));
    }

    private String normalize(String sourceId) {
        if (sourceId == null || sourceId.isBlank()) {
            return "default";
        }
        return sourceId.trim().toLowerCase(Locale.ROOT);
    }
}
