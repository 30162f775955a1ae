package com.civicbiz.catalog.ingest.model;

import java.time.Instant;
import java.util.List;

public record ScrapeRunReport(
    Long runId,
    String status,
    boolean dryRun,
    Instant startedAt,
    Instant finishedAt,
    long durationMs,
    int totalStates,
    int overallTarget,
    int totalProcessed,
    int totalSuccess,
    int totalFailed,
    double successRate,
    double completionRate,
    List<TierResult> tiers,
    ScrapePlan plan
) {
    public ScrapeRunReport {
        tiers = tiers == null ? List.of() : List.copyOf(tiers);
    }
}
