package com.civicbiz.catalog.ingest.source;

import com.civicbiz.catalog.ingest.model.HttpFetchResult;
import com.civicbiz.catalog.ingest.util.SourceErrorClassifier;

/**
 * Failure talking to an external business source. {@link #isRetryable()} tells the retry policy
 * whether another attempt can help.
 */
public class SourceException extends RuntimeException {
    private final String source;
    private final String reasonCode;
    private final boolean retryable;

    public SourceException(String source, String reasonCode, boolean retryable, String message) {
        this(source, reasonCode, retryable, message, null);
    }

    public SourceException(String source, String reasonCode, boolean retryable, String message, Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
        this.reasonCode = reasonCode;
        this.retryable = retryable;
    }

    public static SourceException fromResponse(String source, HttpFetchResult result) {
        String reason = SourceErrorClassifier.classify(result);
        String detail = result.errorCode() != null
            ? result.errorCode() + " " + (result.errorMessage() == null ? "" : result.errorMessage()).trim()
            : "HTTP " + result.statusCode();
        if (SourceErrorClassifier.isRateLimit(reason)) {
            return new RateLimitedException(source, reason, detail + " from " + result.requestedUrl());
        }
        return new SourceException(
            source,
            reason,
            SourceErrorClassifier.isRetryable(reason),
            detail + " from " + result.requestedUrl()
        );
    }

    public String getSource() {
        return source;
    }

    public String getReasonCode() {
        return reasonCode;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
