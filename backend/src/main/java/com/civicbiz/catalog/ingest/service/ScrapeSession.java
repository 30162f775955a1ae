package com.civicbiz.catalog.ingest.service;

import com.civicbiz.catalog.ingest.model.BusinessRecord;
import com.civicbiz.catalog.ingest.model.StateConfig;
import com.civicbiz.catalog.ingest.model.StateResult;
import com.civicbiz.catalog.ingest.util.TextNormalizer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Working state for one state's scrape: the dedup keys seen so far, the records waiting to be
 * written and the running counts. Confined to the worker scraping that state.
 */
public class ScrapeSession {
    static final int MAX_RECORDED_ERRORS = 200;

    private final StateConfig state;
    private final Set<String> seenKeys = new HashSet<>();
    private final List<BusinessRecord> staged = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private int processed;
    private int success;
    private int failed;
    private int duplicatesSkipped;
    private int droppedErrors;

    public ScrapeSession(StateConfig state) {
        this.state = state;
    }

    public StateConfig state() {
        return state;
    }

    /**
     * Returns false for a record whose key an accepted record already claimed; such records are only
     * counted. Admission alone does not claim the key.
     */
    public boolean admit(BusinessRecord record) {
        if (seenKeys.contains(dedupKey(record))) {
            duplicatesSkipped++;
            return false;
        }
        processed++;
        return true;
    }

    /** Reserves the record's key once it passed validation, so later copies count as duplicates. */
    public void claim(BusinessRecord record) {
        seenKeys.add(dedupKey(record));
    }

    public void stage(BusinessRecord record) {
        staged.add(record);
    }

    public List<BusinessRecord> drainStaged() {
        List<BusinessRecord> batch = List.copyOf(staged);
        staged.clear();
        return batch;
    }

    int stagedCount() {
        return staged.size();
    }

    public void recordSuccess() {
        success++;
    }

    public void recordFailure(String reason) {
        failed++;
        recordError(reason);
    }

    public void recordError(String error) {
        if (errors.size() < MAX_RECORDED_ERRORS) {
            errors.add(error);
        } else {
            droppedErrors++;
        }
    }

    public int processed() {
        return processed;
    }

    public int success() {
        return success;
    }

    public int failed() {
        return failed;
    }

    public int duplicatesSkipped() {
        return duplicatesSkipped;
    }

    public List<String> errors() {
        return List.copyOf(errors);
    }

    public StateResult toResult(List<String> disabledSources) {
        List<String> reported = new ArrayList<>(errors);
        if (droppedErrors > 0) {
            reported.add("... " + droppedErrors + " more errors not recorded");
        }
        return new StateResult(
            state.stateName(),
            state.stateCode(),
            state.tier(),
            state.businessTarget(),
            processed,
            success,
            failed,
            duplicatesSkipped,
            reported,
            disabledSources
        );
    }

    static String dedupKey(BusinessRecord record) {
        return TextNormalizer.forComparison(record.name()) + "|" + TextNormalizer.forComparison(record.address());
    }
}
