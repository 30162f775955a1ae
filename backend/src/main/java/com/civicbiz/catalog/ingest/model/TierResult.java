package com.civicbiz.catalog.ingest.model;

import java.util.ArrayList;
import java.util.List;

public record TierResult(
    int tier,
    int target,
    int processed,
    int success,
    int failed,
    List<String> errors,
    List<StateResult> states
) {
    public TierResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        states = states == null ? List.of() : List.copyOf(states);
    }

    public static TierResult of(int tier, List<StateResult> states) {
        int target = 0;
        int processed = 0;
        int success = 0;
        int failed = 0;
        List<String> errors = new ArrayList<>();
        for (StateResult state : states) {
            target += state.target();
            processed += state.processed();
            success += state.success();
            failed += state.failed();
            for (String error : state.errors()) {
                errors.add(state.stateCode() + ": " + error);
            }
        }
        return new TierResult(tier, target, processed, success, failed, errors, states);
    }
}
