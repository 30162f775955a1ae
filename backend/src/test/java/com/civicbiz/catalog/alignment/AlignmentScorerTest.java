package com.civicbiz.catalog.alignment;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlignmentScorerTest {
    private final AlignmentScorer scorer = new AlignmentScorer();

    @Test
    void percentUserAgainstFractionBusiness() {
        AlignmentVector user = AlignmentVector.percent(Map.of(
            AlignmentAxis.LIBERAL, 100.0,
            AlignmentAxis.CONSERVATIVE, 0.0,
            AlignmentAxis.LIBERTARIAN, 0.0,
            AlignmentAxis.GREEN, 0.0,
            AlignmentAxis.CENTRIST, 0.0
        ));
        AlignmentVector business = AlignmentVector.fraction(Map.of(
            AlignmentAxis.LIBERAL, 0.9,
            AlignmentAxis.CONSERVATIVE, 0.1,
            AlignmentAxis.LIBERTARIAN, 0.0,
            AlignmentAxis.GREEN, 0.0,
            AlignmentAxis.CENTRIST, 0.0
        ));

        assertThat(scorer.score(user, business)).isEqualTo(90);
    }

    @Test
    void sameWeightsScoreTheSameOnEitherScale() {
        AlignmentVector business = AlignmentVector.percent(Map.of(
            AlignmentAxis.GREEN, 80.0,
            AlignmentAxis.CENTRIST, 40.0
        ));
        AlignmentVector percentUser = AlignmentVector.percent(Map.of(
            AlignmentAxis.GREEN, 50.0,
            AlignmentAxis.CENTRIST, 50.0
        ));
        AlignmentVector fractionUser = AlignmentVector.fraction(Map.of(
            AlignmentAxis.GREEN, 0.5,
            AlignmentAxis.CENTRIST, 0.5
        ));

        assertThat(scorer.score(percentUser, business)).isEqualTo(60);
        assertThat(scorer.score(fractionUser, business)).isEqualTo(60);
    }

    @Test
    void zeroOrMissingUserWeightsScoreZero() {
        AlignmentVector business = AlignmentVector.percent(Map.of(AlignmentAxis.LIBERAL, 90.0));

        assertThat(scorer.score(AlignmentVector.percent(Map.of()), business)).isZero();
        assertThat(scorer.score(AlignmentVector.percent(Map.of(AlignmentAxis.LIBERAL, 0.0)), business)).isZero();
        assertThat(scorer.score(null, business)).isZero();
    }

    @Test
    void axesTheBusinessDoesNotCarryAreIgnored() {
        AlignmentVector user = AlignmentVector.percent(Map.of(
            AlignmentAxis.LIBERAL, 50.0,
            AlignmentAxis.GREEN, 50.0
        ));
        AlignmentVector business = AlignmentVector.percent(Map.of(AlignmentAxis.LIBERAL, 70.0));

        assertThat(scorer.score(user, business)).isEqualTo(70);
        assertThat(scorer.score(user, AlignmentVector.percent(Map.of(AlignmentAxis.CENTRIST, 70.0)))).isZero();
    }

    @Test
    void raisingBusinessWeightNeverLowersScore() {
        AlignmentVector user = AlignmentVector.percent(Map.of(
            AlignmentAxis.LIBERAL, 30.0,
            AlignmentAxis.CONSERVATIVE, 70.0
        ));
        int previous = -1;
        for (double conservative = 0; conservative <= 100; conservative += 10) {
            AlignmentVector business = AlignmentVector.percent(Map.of(
                AlignmentAxis.LIBERAL, 50.0,
                AlignmentAxis.CONSERVATIVE, conservative
            ));
            int score = scorer.score(user, business);
            assertThat(score).isBetween(0, 100).isGreaterThanOrEqualTo(previous);
            previous = score;
        }
    }

    @Test
    void dominantAxisPicksHeaviestWeight() {
        AlignmentVector vector = AlignmentVector.fromKeys(AlignmentScale.PERCENT, Map.of(
            "liberal", 20.0,
            "Libertarian", 65.0,
            "green", 15.0
        ));

        assertThat(scorer.dominantAxis(vector)).contains(AlignmentAxis.LIBERTARIAN);
        assertThat(scorer.dominantAxis(AlignmentVector.percent(Map.of()))).isEmpty();
    }

    @Test
    void rejectsNegativeWeightsAndUnknownAxes() {
        assertThatThrownBy(() -> AlignmentVector.percent(Map.of(AlignmentAxis.GREEN, -1.0)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("green");
        assertThatThrownBy(() -> AlignmentVector.fromKeys(AlignmentScale.PERCENT, Map.of("socialist", 10.0)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown alignment axis");
    }
}
