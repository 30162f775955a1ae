package com.civicbiz.catalog.alignment;

import java.util.Locale;

public enum AlignmentAxis {
    LIBERAL,
    CONSERVATIVE,
    LIBERTARIAN,
    GREEN,
    CENTRIST;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AlignmentAxis fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Alignment axis is required");
        }
        try {
            return valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown alignment axis: " + key, e);
        }
    }
}
