package com.civicbiz.catalog.ingest.source;

/** The source reported throttling or blocking. Retryable, but with a longer backoff. */
public class RateLimitedException extends SourceException {
    public RateLimitedException(String source, String reasonCode, String message) {
        super(source, reasonCode, true, message);
    }
}
