package com.civicbiz.catalog.ingest.model;

/**
 * A search hit. {@code record} is present when the search response already carried the
 * business attributes; otherwise {@code ref} identifies the detail to fetch.
 */
public record SourceCandidate(String sourceId, String ref, SearchQuery query, RawBusinessRecord record) {

    public static SourceCandidate ref(String sourceId, String ref, SearchQuery query) {
        return new SourceCandidate(sourceId, ref, query, null);
    }

    public static SourceCandidate resolved(String sourceId, String ref, SearchQuery query, RawBusinessRecord record) {
        return new SourceCandidate(sourceId, ref, query, record);
    }

    public boolean needsDetail() {
        return record == null;
    }
}
