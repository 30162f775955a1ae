package com.civicbiz.catalog.ingest.model;

import java.time.Instant;
import java.util.Map;

/**
 * Catalog and pipeline health at a point in time. Accepted businesses are those scoring above the
 * acceptance threshold; the error rate is the percentage that do not.
 */
public record ScrapingMetrics(
    int totalBusinesses,
    int acceptedBusinesses,
    int rejectedBusinesses,
    double averageDataQuality,
    Map<String, Integer> businessesByCategory,
    Map<String, Integer> businessesByState,
    Map<Integer, Integer> businessesByTier,
    Map<String, Integer> businessesBySource,
    double businessesPerMinute,
    double errorRate,
    Map<String, Long> eventCounts,
    int bufferedEvents,
    long droppedEvents,
    Instant lastUpdated
) {
}
