package com.civicbiz.catalog.ingest.process;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Maps free-form source categories onto the catalog's category names by keyword. Values that
 * already are catalog category names pass through unchanged.
 */
public final class CategoryNormalizer {
    private static final Map<Pattern, String> KEYWORDS = new LinkedHashMap<>();
    private static final Set<String> CANONICAL;

    static {
        keywords("Food & Dining", "restaurant", "food", "dining", "cafe", "coffee", "bar", "bakery");
        keywords("Retail", "retail", "shop", "store", "shopping", "boutique");
        keywords("Healthcare", "healthcare", "health care", "medical", "hospital", "clinic", "dentist", "pharmacy");
        keywords("Financial Services", "bank", "credit union", "investment", "insurance", "finance", "financial");
        keywords("Legal Services", "legal services", "law", "lawyer", "attorney");
        keywords("Professional Services", "professional", "legal", "consulting", "accounting");
        keywords("Entertainment", "entertainment", "movie", "theater", "music");
        keywords("Education", "education", "school", "university", "training");
        keywords("Travel & Tourism", "travel", "hotel", "tourism", "lodging");
        keywords("Automotive", "automotive", "car", "auto", "repair");
        keywords("Real Estate", "real estate", "property", "housing");
        keywords("Technology", "technology", "tech", "software", "it services");
        keywords("Fitness & Wellness", "fitness", "gym", "wellness");
        keywords("Beauty & Personal Care", "beauty", "salon", "spa", "barber");
        keywords("Home Services", "home services", "plumbing", "electrical", "cleaning", "hvac");
        keywords("Government & Public Services", "government", "public");
        keywords("Non-profit & Organizations", "non-profit", "nonprofit", "charity");
        keywords("Manufacturing & Industrial", "manufacturing", "industrial");
        keywords("Agriculture", "agriculture", "farm", "agribusiness");
        keywords("Media & Publishing", "media", "publishing", "broadcasting");
        keywords("Construction", "construction", "contractor");

        Set<String> canonical = new LinkedHashSet<>();
        for (String value : KEYWORDS.values()) {
            canonical.add(value.toLowerCase(Locale.ROOT));
        }
        CANONICAL = Collections.unmodifiableSet(canonical);
    }

    private CategoryNormalizer() {
    }

    public static String normalize(String category) {
        if (category == null || category.isBlank()) {
            return null;
        }
        String value = category.trim();
        String lower = value.toLowerCase(Locale.ROOT);
        if (CANONICAL.contains(lower)) {
            return canonicalSpelling(lower);
        }
        for (Map.Entry<Pattern, String> entry : KEYWORDS.entrySet()) {
            if (entry.getKey().matcher(lower).find()) {
                return entry.getValue();
            }
        }
        return value;
    }

    private static String canonicalSpelling(String lower) {
        for (String value : KEYWORDS.values()) {
            if (value.toLowerCase(Locale.ROOT).equals(lower)) {
                return value;
            }
        }
        return lower;
    }

    private static void keywords(String category, String... words) {
        for (String word : words) {
            KEYWORDS.put(Pattern.compile("\\b" + Pattern.quote(word) + "s?\\b"), category);
        }
    }
}
