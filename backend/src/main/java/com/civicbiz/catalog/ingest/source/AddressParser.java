package com.civicbiz.catalog.ingest.source;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits one-line US addresses such as "street[, unit], city, ST 12345[, country]". Parsing
 * anchors on the last "ST 12345" part, so unit lines and a trailing country do not shift the
 * other fields.
 */
final class AddressParser {
    private static final Pattern STATE_ZIP = Pattern.compile("^([A-Za-z]{2})\\s+(\\d{5}(?:-\\d{4})?)$");
    private static final Pattern STATE_ONLY = Pattern.compile("^[A-Za-z]{2}$");
    private static final Pattern COUNTRY = Pattern.compile("^(USA|US|United States(?: of America)?)$", Pattern.CASE_INSENSITIVE);

    private AddressParser() {
    }

    static ParsedAddress parse(String address) {
        if (address == null || address.isBlank()) {
            return new ParsedAddress(null, null, null, null);
        }
        List<String> parts = new ArrayList<>();
        for (String part : address.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                parts.add(trimmed);
            }
        }
        if (!parts.isEmpty() && COUNTRY.matcher(parts.get(parts.size() - 1)).matches()) {
            parts.remove(parts.size() - 1);
        }
        if (parts.isEmpty()) {
            return new ParsedAddress(null, null, null, null);
        }

        for (int i = parts.size() - 1; i >= 1; i--) {
            Matcher matcher = STATE_ZIP.matcher(parts.get(i));
            if (matcher.matches()) {
                return split(parts, i, matcher.group(1), matcher.group(2));
            }
        }
        // No zip anywhere: accept a bare state code as the last part.
        int last = parts.size() - 1;
        if (last >= 1 && STATE_ONLY.matcher(parts.get(last)).matches()) {
            return split(parts, last, parts.get(last), null);
        }
        return new ParsedAddress(parts.get(0), parts.size() > 1 ? parts.get(1) : null, null, null);
    }

    private static ParsedAddress split(List<String> parts, int stateIndex, String state, String zip) {
        String normalizedState = state.toUpperCase(Locale.ROOT);
        if (stateIndex == 1) {
            // "city, ST 12345" without a street line
            return new ParsedAddress(null, parts.get(0), normalizedState, zip);
        }
        String street = String.join(", ", parts.subList(0, stateIndex - 1));
        return new ParsedAddress(street, parts.get(stateIndex - 1), normalizedState, zip);
    }

    static boolean mentionsCity(String address, String city) {
        if (address == null || city == null || city.isBlank()) {
            return false;
        }
        return address.toLowerCase(Locale.ROOT).contains(city.trim().toLowerCase(Locale.ROOT));
    }

    record ParsedAddress(String street, String city, String state, String zipCode) {
    }
}
