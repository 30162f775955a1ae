package com.civicbiz.catalog.alignment;

/** The range a vector's weights are expressed in. */
public enum AlignmentScale {
    FRACTION(1.0),
    PERCENT(100.0);

    private final double max;

    AlignmentScale(double max) {
        this.max = max;
    }

    public double max() {
        return max;
    }

    public double toFraction(double value) {
        return Math.min(1.0, Math.max(0.0, value / max));
    }
}
