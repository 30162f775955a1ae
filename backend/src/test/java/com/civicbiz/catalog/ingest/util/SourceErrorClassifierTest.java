package com.civicbiz.catalog.ingest.util;

import com.civicbiz.catalog.ingest.model.HttpFetchResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SourceErrorClassifierTest {

    @Test
    void statusCodesMapToReasons() {
        assertEquals(SourceErrorClassifier.HTTP_401, SourceErrorClassifier.fromHttpStatus(401));
        assertEquals(SourceErrorClassifier.HTTP_403_BLOCKED, SourceErrorClassifier.fromHttpStatus(403));
        assertEquals(SourceErrorClassifier.TIMEOUT, SourceErrorClassifier.fromHttpStatus(408));
        assertEquals(SourceErrorClassifier.HTTP_429_RATE_LIMIT, SourceErrorClassifier.fromHttpStatus(429));
        assertEquals(SourceErrorClassifier.HTTP_4XX, SourceErrorClassifier.fromHttpStatus(410));
        assertEquals(SourceErrorClassifier.HTTP_5XX, SourceErrorClassifier.fromHttpStatus(502));
    }

    @Test
    void transportErrorsWinOverStatus() {
        HttpFetchResult result = new HttpFetchResult(
            "https://api.yelp.com/v3", 0, null, null, Instant.now(), Duration.ZERO, "timeout", "read timed out");
        assertEquals(SourceErrorClassifier.TIMEOUT, SourceErrorClassifier.classify(result));
        assertEquals(SourceErrorClassifier.UNKNOWN, SourceErrorClassifier.classify(null));
    }

    @Test
    void onlyTransientReasonsAreRetryable() {
        assertTrue(SourceErrorClassifier.isRetryable(SourceErrorClassifier.HTTP_5XX));
        assertTrue(SourceErrorClassifier.isRetryable(SourceErrorClassifier.IO_ERROR));
        assertTrue(SourceErrorClassifier.isRateLimit(SourceErrorClassifier.HTTP_403_BLOCKED));
        assertFalse(SourceErrorClassifier.isRetryable(SourceErrorClassifier.HTTP_401));
        assertFalse(SourceErrorClassifier.isRetryable(SourceErrorClassifier.PARSING_FAILED));
        assertFalse(SourceErrorClassifier.isRetryable(null));
    }

    @Test
    void unclassifiedFailuresAreNotRetried() {
        String reason = SourceErrorClassifier.fromErrorCode("http_error");

        assertEquals(SourceErrorClassifier.UNKNOWN, reason);
        assertFalse(SourceErrorClassifier.isRetryable(reason));
        assertTrue(SourceErrorClassifier.isRetryable(SourceErrorClassifier.fromErrorCode("timeout")));
    }
}
