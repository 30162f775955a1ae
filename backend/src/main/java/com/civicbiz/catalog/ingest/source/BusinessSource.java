package com.civicbiz.catalog.ingest.source;

import com.civicbiz.catalog.ingest.model.RawBusinessRecord;
import com.civicbiz.catalog.ingest.model.SearchQuery;
import com.civicbiz.catalog.ingest.model.SourceCandidate;

import java.util.List;
import java.util.Optional;

public interface BusinessSource {

    String id();

    /** False when the source lacks the credentials it needs. */
    boolean isConfigured();

    List<SourceCandidate> fetchCandidates(SearchQuery query);

    /**
     * Resolves a candidate to its full record. Empty when the detail turns out to lie outside the
     * queried geography.
     */
    default Optional<RawBusinessRecord> fetchDetail(SourceCandidate candidate) {
        return Optional.ofNullable(candidate.record());
    }
}
