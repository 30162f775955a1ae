package com.civicbiz.catalog.ingest.model;

public record ScrapeRunRequest(
    Integer targetCount,
    Integer tier,
    String state,
    boolean dryRun
) {
    public static ScrapeRunRequest all() {
        return new ScrapeRunRequest(null, null, null, false);
    }

    public boolean hasTargetCap() {
        return targetCount != null && targetCount > 0;
    }
}
