package com.civicbiz.catalog.alignment;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Non-negative weights over the alignment axes. Axes without a weight are absent rather than
 * zero, which matters to the scorer.
 */
public record AlignmentVector(AlignmentScale scale, Map<AlignmentAxis, Double> weights) {

    public AlignmentVector {
        if (scale == null) {
            throw new IllegalArgumentException("Alignment scale is required");
        }
        EnumMap<AlignmentAxis, Double> copy = new EnumMap<>(AlignmentAxis.class);
        if (weights != null) {
            for (Map.Entry<AlignmentAxis, Double> entry : weights.entrySet()) {
                Double value = entry.getValue();
                if (entry.getKey() == null || value == null) {
                    continue;
                }
                if (!Double.isFinite(value) || value < 0) {
                    throw new IllegalArgumentException(
                        "Alignment weight for " + entry.getKey().key() + " must be a non-negative number");
                }
                copy.put(entry.getKey(), value);
            }
        }
        weights = Collections.unmodifiableMap(copy);
    }

    public static AlignmentVector percent(Map<AlignmentAxis, Double> weights) {
        return new AlignmentVector(AlignmentScale.PERCENT, weights);
    }

    public static AlignmentVector fraction(Map<AlignmentAxis, Double> weights) {
        return new AlignmentVector(AlignmentScale.FRACTION, weights);
    }

    public static AlignmentVector fromKeys(AlignmentScale scale, Map<String, Double> weights) {
        Map<AlignmentAxis, Double> parsed = new LinkedHashMap<>();
        if (weights != null) {
            weights.forEach((key, value) -> parsed.put(AlignmentAxis.fromKey(key), value));
        }
        return new AlignmentVector(scale, parsed);
    }

    public OptionalDouble weight(AlignmentAxis axis) {
        Double value = weights.get(axis);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public boolean has(AlignmentAxis axis) {
        return weights.containsKey(axis);
    }

    public double fractionOf(AlignmentAxis axis) {
        Double value = weights.get(axis);
        return value == null ? 0.0 : scale.toFraction(value);
    }
}
