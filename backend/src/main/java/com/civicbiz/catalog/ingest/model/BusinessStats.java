package com.civicbiz.catalog.ingest.model;

import java.util.Map;

public record BusinessStats(
    int total,
    Map<String, Integer> byCategory,
    Map<String, Integer> byState,
    Map<String, Integer> bySource,
    double averageQuality
) {
}
