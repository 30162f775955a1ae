package com.civicbiz.catalog.ingest.model;

public record DataQualityReport(
    int totalBusinesses,
    int validBusinesses,
    int invalidBusinesses,
    int duplicateGroups,
    double averageQualityScore,
    IssueCounts issues
) {
    public record IssueCounts(int critical, int warning, int info) {
    }
}
