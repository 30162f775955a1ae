package com.civicbiz.catalog.alignment;

import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Weighted match between a user's alignment vector and a business's, as a whole percentage.
 * Only axes both vectors carry and the user weights above zero take part. A user with no
 * weights, or a business unrated on every weighted axis, scores 0.
 */
@Component
public class AlignmentScorer {

    public int score(AlignmentVector user, AlignmentVector business) {
        if (user == null || business == null) {
            return 0;
        }
        double score = 0.0;
        double totalWeight = 0.0;
        for (AlignmentAxis axis : AlignmentAxis.values()) {
            if (!user.has(axis) || !business.has(axis)) {
                continue;
            }
            double weight = user.fractionOf(axis);
            if (weight <= 0) {
                continue;
            }
            score += business.fractionOf(axis) * weight;
            totalWeight += weight;
        }
        if (totalWeight == 0) {
            return 0;
        }
        return (int) Math.round(score / totalWeight * 100);
    }

    public Optional<AlignmentAxis> dominantAxis(AlignmentVector vector) {
        AlignmentAxis best = null;
        double bestWeight = 0.0;
        for (AlignmentAxis axis : AlignmentAxis.values()) {
            double weight = vector.fractionOf(axis);
            if (weight > bestWeight) {
                best = axis;
                bestWeight = weight;
            }
        }
        return Optional.ofNullable(best);
    }
}
