package com.civicbiz.catalog.ingest.service;

import com.civicbiz.catalog.ingest.source.BusinessSource;

import java.util.List;

/** Everything a state worker shares with the rest of its run. */
public record ScrapeRunContext(
    Long runId,
    List<BusinessSource> sources,
    RetryPolicy retryPolicy,
    SourceThrottleTracker throttle,
    TargetBudget budget
) {
    public ScrapeRunContext {
        sources = sources == null ? List.of() : List.copyOf(sources);
        budget = budget == null ? TargetBudget.unlimited() : budget;
    }
}
