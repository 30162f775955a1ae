package com.civicbiz.catalog.ingest.service;

import com.civicbiz.catalog.config.PipelineProperties;
import com.civicbiz.catalog.ingest.source.RateLimitedException;
import com.civicbiz.catalog.ingest.source.SourceException;
import com.civicbiz.catalog.ingest.util.SourceErrorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Exponential backoff around a single adapter call. Only retryable {@link SourceException}s are
 * retried; rate-limit signals wait {@code rateLimitFactor} times longer and are reported to the
 * run's throttle tracker.
 */
public class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxRetries;
    private final long baseDelayMs;
    private final double multiplier;
    private final long maxDelayMs;
    private final double rateLimitFactor;
    private final Sleeper sleeper;

    public RetryPolicy(int maxRetries, long baseDelayMs, double multiplier, long maxDelayMs, double rateLimitFactor) {
        this(maxRetries, baseDelayMs, multiplier, maxDelayMs, rateLimitFactor, Thread::sleep);
    }

    RetryPolicy(
        int maxRetries,
        long baseDelayMs,
        double multiplier,
        long maxDelayMs,
        double rateLimitFactor,
        Sleeper sleeper
    ) {
        this.maxRetries = Math.max(0, maxRetries);
        this.baseDelayMs = Math.max(0, baseDelayMs);
        this.multiplier = Math.max(1.0, multiplier);
        this.maxDelayMs = Math.max(this.baseDelayMs, maxDelayMs);
        this.rateLimitFactor = Math.max(1.0, rateLimitFactor);
        this.sleeper = sleeper;
    }

    public static RetryPolicy from(PipelineProperties properties) {
        PipelineProperties.Scraping scraping = properties.getScraping();
        return new RetryPolicy(
            scraping.getMaxRetries(),
            scraping.getRetryDelayMs(),
            scraping.getRetryMultiplier(),
            scraping.getMaxRetryDelayMs(),
            properties.getRateLimit().getRateLimitFactor()
        );
    }

    public <T> T execute(String sourceId, Supplier<T> action, SourceThrottleTracker throttle) {
        int attempt = 0;
        while (true) {
            try {
                return action.get();
            } catch (SourceException e) {
                boolean rateLimited = e instanceof RateLimitedException;
                boolean disabled = false;
                if (rateLimited && throttle != null) {
                    disabled = throttle.recordSignal(sourceId) || throttle.isDisabled(sourceId);
                }
                if (!e.isRetryable() || attempt >= maxRetries || disabled) {
                    throw e;
                }
                attempt++;
                long delay = delayFor(attempt, rateLimited);
                log.debug("Retrying {} in {} ms (attempt {}/{}): {}", sourceId, delay, attempt, maxRetries, e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw new SourceException(
                        sourceId,
                        SourceErrorClassifier.INTERRUPTED,
                        false,
                        "interrupted while backing off",
                        interrupted
                    );
                }
            }
        }
    }

    long delayFor(int attempt, boolean rateLimited) {
        double delay = baseDelayMs * Math.pow(multiplier, Math.max(0, attempt - 1));
        long capped = (long) Math.min(delay, maxDelayMs);
        return rateLimited ? (long) (capped * rateLimitFactor) : capped;
    }

    public int maxRetries() {
        return maxRetries;
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
