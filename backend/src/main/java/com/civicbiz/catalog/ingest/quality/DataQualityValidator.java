package com.civicbiz.catalog.ingest.quality;

import com.civicbiz.catalog.config.PipelineProperties;
import com.civicbiz.catalog.ingest.model.BusinessRecord;
import com.civicbiz.catalog.ingest.model.ValidationResult;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Scores a canonical record out of 100 by subtracting a fixed penalty per defect. Errors make
 * the record invalid; warnings only cost points.
 */
@Component
public class DataQualityValidator {
    static final int MISSING_NAME_PENALTY = 20;
    static final int MISSING_CATEGORY_PENALTY = 15;
    static final int SHORT_NAME_PENALTY = 10;
    static final int LONG_NAME_PENALTY = 5;
    static final int LONG_DESCRIPTION_PENALTY = 3;
    static final int MAX_DESCRIPTION_LENGTH = 500;
    static final int BAD_URL_PENALTY = 10;
    static final int BAD_EMAIL_PENALTY = 10;
    static final int BAD_PHONE_PENALTY = 5;
    static final int BAD_COORDINATE_PENALTY = 10;
    static final int BAD_RATING_PENALTY = 10;
    static final int NO_LOCATION_PENALTY = 8;
    static final int NO_CONTACT_PENALTY = 8;

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern PHONE = Pattern.compile("^[+]?[1-9]\\d{0,15}$");
    private static final Pattern PHONE_SEPARATORS = Pattern.compile("[\\s\\-().]");

    private final int acceptanceThreshold;

    @Autowired
    public DataQualityValidator(PipelineProperties properties) {
        this(properties.getScraping().getAcceptanceThreshold());
    }

    DataQualityValidator(int acceptanceThreshold) {
        this.acceptanceThreshold = acceptanceThreshold;
    }

    public ValidationResult validate(BusinessRecord record) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        int score = 100;

        String name = record.name();
        if (isBlank(name)) {
            errors.add("Business name is required");
            score -= MISSING_NAME_PENALTY;
        } else if (name.trim().length() < 2) {
            errors.add("Business name must be at least 2 characters");
            score -= SHORT_NAME_PENALTY;
        } else if (name.trim().length() > 100) {
            warnings.add("Business name is unusually long");
            score -= LONG_NAME_PENALTY;
        }

        if (record.description() != null && record.description().length() > MAX_DESCRIPTION_LENGTH) {
            warnings.add("Description is unusually long");
            score -= LONG_DESCRIPTION_PENALTY;
        }

        if (isBlank(record.category())) {
            errors.add("Business category is required");
            score -= MISSING_CATEGORY_PENALTY;
        }

        if (!isBlank(record.website()) && !isValidUrl(record.website())) {
            errors.add("Invalid website URL format");
            score -= BAD_URL_PENALTY;
        }

        if (!isBlank(record.email()) && !EMAIL.matcher(record.email().trim()).matches()) {
            errors.add("Invalid email format");
            score -= BAD_EMAIL_PENALTY;
        }

        if (!isBlank(record.phone())) {
            String digits = PHONE_SEPARATORS.matcher(record.phone()).replaceAll("");
            if (!PHONE.matcher(digits).matches()) {
                warnings.add("Phone number format may be invalid");
                score -= BAD_PHONE_PENALTY;
            }
        }

        if (record.latitude() != null && (record.latitude() < -90 || record.latitude() > 90)) {
            errors.add("Invalid latitude value");
            score -= BAD_COORDINATE_PENALTY;
        }
        if (record.longitude() != null && (record.longitude() < -180 || record.longitude() > 180)) {
            errors.add("Invalid longitude value");
            score -= BAD_COORDINATE_PENALTY;
        }

        if (record.rating() != null && (record.rating() < 0 || record.rating() > 5)) {
            errors.add("Rating must be between 0 and 5");
            score -= BAD_RATING_PENALTY;
        }

        if (isBlank(record.address()) && isBlank(record.city())) {
            warnings.add("No location information provided");
            score -= NO_LOCATION_PENALTY;
        }

        if (isBlank(record.website()) && isBlank(record.phone()) && isBlank(record.email())) {
            warnings.add("No contact information provided");
            score -= NO_CONTACT_PENALTY;
        }

        return new ValidationResult(errors.isEmpty(), errors, warnings, Math.max(0, Math.min(100, score)));
    }

    public Map<Integer, ValidationResult> validateAll(List<BusinessRecord> records) {
        Map<Integer, ValidationResult> results = new LinkedHashMap<>();
        for (int i = 0; i < records.size(); i++) {
            results.put(i, validate(records.get(i)));
        }
        return results;
    }

    /** Valid and scoring strictly above the threshold. */
    public boolean isAccepted(ValidationResult result) {
        return result.isAccepted(acceptanceThreshold);
    }

    public int acceptanceThreshold() {
        return acceptanceThreshold;
    }

    private static boolean isValidUrl(String value) {
        try {
            URI uri = new URI(value.trim());
            return uri.getScheme() != null && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
