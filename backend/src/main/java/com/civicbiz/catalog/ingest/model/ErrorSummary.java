package com.civicbiz.catalog.ingest.model;

import java.util.List;
import java.util.Map;

public record ErrorSummary(
    int hours,
    int totalErrors,
    Map<String, Integer> errorsBySource,
    Map<String, Integer> errorsByHour,
    List<SyncLogEntry> recentErrors
) {
}
