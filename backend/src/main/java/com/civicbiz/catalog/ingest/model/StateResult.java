package com.civicbiz.catalog.ingest.model;

import java.util.List;

public record StateResult(
    String stateName,
    String stateCode,
    int tier,
    int target,
    int processed,
    int success,
    int failed,
    int duplicatesSkipped,
    List<String> errors,
    List<String> disabledSources
) {
    public StateResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        disabledSources = disabledSources == null ? List.of() : List.copyOf(disabledSources);
    }

    public static StateResult failed(StateConfig config, String error) {
        return new StateResult(
            config.stateName(),
            config.stateCode(),
            config.tier(),
            config.businessTarget(),
            0,
            0,
            0,
            0,
            List.of(error),
            List.of()
        );
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
