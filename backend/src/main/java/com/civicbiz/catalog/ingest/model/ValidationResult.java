package com.civicbiz.catalog.ingest.model;

import java.util.List;

public record ValidationResult(boolean isValid, List<String> errors, List<String> warnings, int score) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean isAccepted(int threshold) {
        return isValid && score > threshold;
    }
}
