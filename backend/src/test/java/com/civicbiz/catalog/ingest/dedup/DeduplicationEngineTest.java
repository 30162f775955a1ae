package com.civicbiz.catalog.ingest.dedup;

import com.civicbiz.catalog.ingest.model.BusinessRecord;
import com.civicbiz.catalog.ingest.model.DuplicateGroup;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.civicbiz.catalog.ingest.TestBusinesses.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DeduplicationEngineTest {
    private final DeduplicationEngine engine = new DeduplicationEngine(0.85);

    @Test
    void groupsSpellingVariantsOfTheSameCoffeeShop() {
        BusinessRecord first = record(1L, "Joe's Coffee", "1 Main St", "Food & Dining");
        BusinessRecord second = record(2L, "Joes Coffee", "1 Main Street", "Food & Dining");

        List<DuplicateGroup> groups = engine.findDuplicateGroups(List.of(first, second));

        assertThat(groups).hasSize(1);
        DuplicateGroup group = groups.get(0);
        assertThat(group.representativeId()).isEqualTo(1L);
        assertThat(group.memberIds()).containsExactly(1L, 2L);
        assertThat(group.confidence()).isGreaterThanOrEqualTo(0.85);
        assertThat(group.confidence()).isCloseTo(0.969, within(0.001));
        assertThat(group.members().get(0).similarityScore()).isEqualTo(1.0);
    }

    @Test
    void similarityIsSymmetricAndBounded() {
        BusinessRecord first = record(1L, "Joe's Coffee", "1 Main St", "Food & Dining");
        BusinessRecord second = record(2L, "Blue Door Bakery", null, "Retail");

        double forward = engine.similarity(first, second);
        double backward = engine.similarity(second, first);

        assertThat(forward).isCloseTo(backward, within(1e-12));
        assertThat(forward).isBetween(0.0, 1.0);
        assertThat(engine.similarity(first, first)).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void missingAddressContributesNothing() {
        BusinessRecord first = record(1L, "Prairie Books", null, "Retail");
        BusinessRecord second = record(2L, "Prairie Books", null, "Retail");

        assertThat(engine.similarity(first, second)).isCloseTo(0.7, within(1e-9));
        assertThat(engine.findDuplicateGroups(List.of(first, second))).isEmpty();
        assertThat(engine.findDuplicateGroups(List.of(first, second), 0.69)).hasSize(1);
    }

    @Test
    void eachRecordJoinsAtMostOneGroup() {
        List<BusinessRecord> catalog = List.of(
            record(1L, "Joe's Coffee", "1 Main St", "Food & Dining"),
            record(2L, "Joes Coffee", "1 Main Street", "Food & Dining"),
            record(3L, "Joe's Coffee", "1 Main St.", "Food & Dining"),
            record(4L, "Hawkeye Hardware", "900 Grand Ave", "Retail"),
            record(5L, "Hawkeye Hardware Inc", "900 Grand Avenue", "Retail")
        );

        List<DuplicateGroup> groups = engine.findDuplicateGroups(catalog);

        assertThat(groups).hasSize(2);
        assertThat(groups.get(0).memberIds()).containsExactly(1L, 2L, 3L);
        assertThat(groups.get(1).memberIds()).containsExactly(4L, 5L);
    }

    @Test
    void skipsRecordsWithoutIds() {
        List<BusinessRecord> catalog = List.of(
            record(null, "Joe's Coffee", "1 Main St", "Food & Dining"),
            record(2L, "Joes Coffee", "1 Main Street", "Food & Dining")
        );

        assertThat(engine.findDuplicateGroups(catalog)).isEmpty();
    }

    @Test
    void categoryComparisonIgnoresCaseAndPadding() {
        assertThat(DeduplicationEngine.categorySimilarity(" retail", "Retail ")).isEqualTo(1.0);
        assertThat(DeduplicationEngine.categorySimilarity("Retail", null)).isEqualTo(0.0);
        assertThat(DeduplicationEngine.categorySimilarity("Retail", "Healthcare")).isEqualTo(0.0);
    }
}
