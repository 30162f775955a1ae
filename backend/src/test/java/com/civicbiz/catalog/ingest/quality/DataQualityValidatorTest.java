package com.civicbiz.catalog.ingest.quality;

import com.civicbiz.catalog.ingest.model.BusinessRecord;
import com.civicbiz.catalog.ingest.model.ValidationResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.civicbiz.catalog.ingest.TestBusinesses.FIXED_TIME;
import static com.civicbiz.catalog.ingest.TestBusinesses.record;
import static org.assertj.core.api.Assertions.assertThat;

class DataQualityValidatorTest {
    private final DataQualityValidator validator = new DataQualityValidator(60);

    @Test
    void completeRecordScoresFullMarks() {
        ValidationResult result = validator.validate(record(1L, "Joe's Coffee", "1 Main St", "Food & Dining"));

        assertThat(result.isValid()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(result.warnings()).isEmpty();
        assertThat(result.score()).isEqualTo(100);
        assertThat(validator.isAccepted(result)).isTrue();
    }

    @Test
    void missingCategoryIsAnError() {
        ValidationResult result = validator.validate(record(1L, "Joe's Coffee", "1 Main St", null));

        assertThat(result.isValid()).isFalse();
        assertThat(result.errors()).containsExactly("Business category is required");
        assertThat(result.score()).isEqualTo(85);
        assertThat(validator.isAccepted(result)).isFalse();
    }

    @Test
    void penaltiesAccumulatePerDefect() {
        BusinessRecord record = new BusinessRecord(
            null, "", null, " ", null, null, null, null, "12", "bad@", "not a url",
            123.0, 200.0, 9.0, null, null, 0, "Yelp", FIXED_TIME, FIXED_TIME, true
        );

        ValidationResult result = validator.validate(record);

        assertThat(result.isValid()).isFalse();
        assertThat(result.errors()).contains(
            "Business name is required",
            "Business category is required",
            "Invalid website URL format",
            "Invalid email format",
            "Invalid latitude value",
            "Invalid longitude value",
            "Rating must be between 0 and 5"
        );
        assertThat(result.warnings()).containsExactly("No location information provided");
        assertThat(result.score()).isEqualTo(7);
    }

    @Test
    void warningsCostPointsWithoutInvalidating() {
        BusinessRecord record = new BusinessRecord(
            null, "Prairie Books", null, "Retail", null, null, "IA", null, null, null, null,
            null, null, null, null, null, 0, "Google", FIXED_TIME, FIXED_TIME, true
        );

        ValidationResult result = validator.validate(record);

        assertThat(result.isValid()).isTrue();
        assertThat(result.warnings()).containsExactly(
            "No location information provided",
            "No contact information provided"
        );
        assertThat(result.score()).isEqualTo(84);
    }

    @Test
    void scoreMustBeAboveTheThreshold() {
        BusinessRecord record = new BusinessRecord(
            null, "Prairie Books", null, "Retail", null, null, "IA", null, null, null, null,
            null, null, null, null, null, 0, "Google", FIXED_TIME, FIXED_TIME, true
        );
        ValidationResult result = validator.validate(record);
        assertThat(result.score()).isEqualTo(84);

        assertThat(new DataQualityValidator(84).isAccepted(result)).isFalse();
        assertThat(new DataQualityValidator(83).isAccepted(result)).isTrue();
    }

    @Test
    void longDescriptionIsAWarning() {
        BusinessRecord base = record(1L, "Joe's Coffee", "1 Main St", "Food & Dining");
        BusinessRecord verbose = new BusinessRecord(
            base.id(), base.name(), "x".repeat(501), base.category(), base.address(), base.city(), base.state(),
            base.zipCode(), base.phone(), base.email(), base.website(), base.latitude(), base.longitude(),
            base.rating(), base.reviewCount(), base.imageUrl(), base.dataQuality(), base.source(),
            base.createdAt(), base.updatedAt(), base.isActive()
        );

        ValidationResult result = validator.validate(verbose);

        assertThat(result.isValid()).isTrue();
        assertThat(result.warnings()).containsExactly("Description is unusually long");
        assertThat(result.score()).isEqualTo(97);
        assertThat(validator.validate(base).score()).isEqualTo(100);
    }

    @Test
    void validateAllKeysResultsByPosition() {
        Map<Integer, ValidationResult> results = validator.validateAll(List.of(
            record(1L, "Joe's Coffee", "1 Main St", "Food & Dining"),
            record(2L, "J", "1 Main St", "Food & Dining")
        ));

        assertThat(results).containsOnlyKeys(0, 1);
        assertThat(results.get(0).isValid()).isTrue();
        assertThat(results.get(1).errors()).containsExactly("Business name must be at least 2 characters");
        assertThat(results.get(1).score()).isEqualTo(90);
    }
}
