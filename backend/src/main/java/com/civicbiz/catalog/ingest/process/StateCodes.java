package com.civicbiz.catalog.ingest.process;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class StateCodes {
    private static final Map<String, String> NAME_TO_CODE;
    private static final Map<String, String> CODE_TO_NAME;

    static {
        Map<String, String> names = new LinkedHashMap<>();
        entry(names, "Alabama", "AL");
        entry(names, "Alaska", "AK");
        entry(names, "Arizona", "AZ");
        entry(names, "Arkansas", "AR");
        entry(names, "California", "CA");
        entry(names, "Colorado", "CO");
        entry(names, "Connecticut", "CT");
        entry(names, "Delaware", "DE");
        entry(names, "District of Columbia", "DC");
        entry(names, "Florida", "FL");
        entry(names, "Georgia", "GA");
        entry(names, "Hawaii", "HI");
        entry(names, "Idaho", "ID");
        entry(names, "Illinois", "IL");
        entry(names, "Indiana", "IN");
        entry(names, "Iowa", "IA");
        entry(names, "Kansas", "KS");
        entry(names, "Kentucky", "KY");
        entry(names, "Louisiana", "LA");
        entry(names, "Maine", "ME");
        entry(names, "Maryland", "MD");
        entry(names, "Massachusetts", "MA");
        entry(names, "Michigan", "MI");
        entry(names, "Minnesota", "MN");
        entry(names, "Mississippi", "MS");
        entry(names, "Missouri", "MO");
        entry(names, "Montana", "MT");
        entry(names, "Nebraska", "NE");
        entry(names, "Nevada", "NV");
        entry(names, "New Hampshire", "NH");
        entry(names, "New Jersey", "NJ");
        entry(names, "New Mexico", "NM");
        entry(names, "New York", "NY");
        entry(names, "North Carolina", "NC");
        entry(names, "North Dakota", "ND");
        entry(names, "Ohio", "OH");
        entry(names, "Oklahoma", "OK");
        entry(names, "Oregon", "OR");
        entry(names, "Pennsylvania", "PA");
        entry(names, "Rhode Island", "RI");
        entry(names, "South Carolina", "SC");
        entry(names, "South Dakota", "SD");
        entry(names, "Tennessee", "TN");
        entry(names, "Texas", "TX");
        entry(names, "Utah", "UT");
        entry(names, "Vermont", "VT");
        entry(names, "Virginia", "VA");
        entry(names, "Washington", "WA");
        entry(names, "West Virginia", "WV");
        entry(names, "Wisconsin", "WI");
        entry(names, "Wyoming", "WY");
        Map<String, String> byLowerName = new LinkedHashMap<>();
        Map<String, String> codes = new LinkedHashMap<>();
        names.forEach((name, code) -> {
            byLowerName.put(name.toLowerCase(Locale.ROOT), code);
            codes.put(code, name);
        });
        NAME_TO_CODE = Collections.unmodifiableMap(byLowerName);
        CODE_TO_NAME = Collections.unmodifiableMap(codes);
    }

    private StateCodes() {
    }

    /**
     * Two-letter code for a full state name or code, matched case-insensitively. Anything else
     * falls back to its first two letters upper-cased; input without letters yields null.
     */
    public static String normalize(String input) {
        if (input == null) {
            return null;
        }
        String value = input.trim().replaceAll("\\s+", " ");
        if (value.isEmpty()) {
            return null;
        }
        Optional<String> known = lookup(value);
        if (known.isPresent()) {
            return known.get();
        }
        String letters = value.toUpperCase(Locale.ROOT).replaceAll("[^A-Z]", "");
        if (letters.isEmpty()) {
            return null;
        }
        return letters.length() <= 2 ? letters : letters.substring(0, 2);
    }

    public static Optional<String> lookup(String input) {
        if (input == null || input.isBlank()) {
            return Optional.empty();
        }
        String value = input.trim().replaceAll("\\s+", " ");
        String upper = value.toUpperCase(Locale.ROOT);
        if (CODE_TO_NAME.containsKey(upper)) {
            return Optional.of(upper);
        }
        String lower = value.toLowerCase(Locale.ROOT);
        return Optional.ofNullable(NAME_TO_CODE.get(lower));
    }

    public static Optional<String> nameFor(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(CODE_TO_NAME.get(code.trim().toUpperCase(Locale.ROOT)));
    }

    private static void entry(Map<String, String> names, String name, String code) {
        names.put(name, code);
    }
}
