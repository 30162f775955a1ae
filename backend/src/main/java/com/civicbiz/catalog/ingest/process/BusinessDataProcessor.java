package com.civicbiz.catalog.ingest.process;

import com.civicbiz.catalog.ingest.model.BusinessRecord;
import com.civicbiz.catalog.ingest.model.BusinessStats;
import com.civicbiz.catalog.ingest.model.RawBusinessRecord;
import com.civicbiz.catalog.ingest.util.TextNormalizer;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns adapter output into canonical business records. Cleaning a record that is already
 * canonical returns it unchanged.
 */
@Component
public class BusinessDataProcessor {
    private static final Map<String, String> SOURCE_NAMES = new LinkedHashMap<>();

    static {
        SOURCE_NAMES.put("google", "Google");
        SOURCE_NAMES.put("bing", "Bing");
        SOURCE_NAMES.put("yahoo", "Yahoo");
        SOURCE_NAMES.put("yellowpages", "Yellow Pages");
        SOURCE_NAMES.put("yelp", "Yelp");
        SOURCE_NAMES.put("facebook", "Facebook");
        SOURCE_NAMES.put("linkedin", "LinkedIn");
        SOURCE_NAMES.put("instagram", "Instagram");
    }

    private final Clock clock;

    public BusinessDataProcessor(Clock clock) {
        this.clock = clock;
    }

    public BusinessRecord clean(RawBusinessRecord raw) {
        Instant now = clock.instant();
        Instant createdAt = instant(raw.first("createdAt"));
        Instant updatedAt = instant(raw.first("updatedAt"));
        return new BusinessRecord(
            id(raw.first("id")),
            text(raw.first("name", "title")),
            text(raw.first("description", "summary")),
            CategoryNormalizer.normalize(text(raw.first("category", "type"))),
            address(raw.first("address", "location")),
            text(raw.first("city", "locality")),
            StateCodes.normalize(text(raw.first("state", "region"))),
            zipCode(text(raw.first("zipCode", "postalCode", "zip"))),
            phone(text(raw.first("phone", "phoneNumber"))),
            email(text(raw.first("email", "contactEmail"))),
            url(text(raw.first("website", "url"))),
            number(raw.first("latitude", "lat")),
            number(raw.first("longitude", "lng")),
            number(raw.first("rating", "score")),
            integer(raw.first("reviewCount", "reviews")),
            url(text(raw.first("imageUrl", "logo", "image"))),
            quality(raw.first("dataQuality")),
            source(raw.source()),
            createdAt == null ? now : createdAt,
            updatedAt == null ? now : updatedAt,
            active(raw.first("isActive"))
        );
    }

    public List<BusinessRecord> cleanAll(List<RawBusinessRecord> records) {
        List<BusinessRecord> cleaned = new ArrayList<>(records.size());
        for (RawBusinessRecord record : records) {
            cleaned.add(clean(record));
        }
        return cleaned;
    }

    public BusinessStats stats(List<BusinessRecord> records) {
        Map<String, Integer> byCategory = new TreeMap<>();
        Map<String, Integer> byState = new TreeMap<>();
        Map<String, Integer> bySource = new TreeMap<>();
        long qualityTotal = 0;
        for (BusinessRecord record : records) {
            byCategory.merge(record.category() == null ? "Uncategorized" : record.category(), 1, Integer::sum);
            byState.merge(record.state() == null ? "Unknown" : record.state(), 1, Integer::sum);
            bySource.merge(record.source(), 1, Integer::sum);
            qualityTotal += record.dataQuality();
        }
        double average = records.isEmpty() ? 0.0 : (double) qualityTotal / records.size();
        return new BusinessStats(records.size(), byCategory, byState, bySource, average);
    }

    static String source(String value) {
        String source = TextNormalizer.clean(value);
        if (source == null) {
            return "Unknown";
        }
        String key = source.toLowerCase(Locale.ROOT).replaceAll("[^a-z]", "");
        for (Map.Entry<String, String> entry : SOURCE_NAMES.entrySet()) {
            if (key.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return source;
    }

    private static String text(Object value) {
        if (value instanceof CharSequence chars) {
            return TextNormalizer.clean(chars.toString());
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        return null;
    }

    private static String address(Object value) {
        String address = text(value);
        if (address == null) {
            return null;
        }
        String trimmed = address.replaceAll("[,\\s]+$", "");
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String phone(String phone) {
        if (phone == null) {
            return null;
        }
        String digits = phone.replaceAll("\\D", "");
        if (digits.length() == 11 && digits.startsWith("1")) {
            digits = digits.substring(1);
        }
        if (digits.length() == 10) {
            return "(" + digits.substring(0, 3) + ") " + digits.substring(3, 6) + "-" + digits.substring(6);
        }
        return phone;
    }

    private static String zipCode(String zip) {
        if (zip == null) {
            return null;
        }
        String digits = zip.replaceAll("\\D", "");
        if (digits.length() == 5) {
            return digits;
        }
        if (digits.length() == 9) {
            return digits.substring(0, 5) + "-" + digits.substring(5);
        }
        return zip;
    }

    private static String email(String email) {
        if (email == null || !email.contains("@") || !email.contains(".")) {
            return null;
        }
        return email.toLowerCase(Locale.ROOT);
    }

    private static String url(String url) {
        if (url == null) {
            return null;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return url;
        }
        if (url.startsWith("//")) {
            return "https:" + url;
        }
        return "https://" + url;
    }

    private static Double number(Object value) {
        if (value instanceof Number number) {
            double result = number.doubleValue();
            return Double.isFinite(result) ? result : null;
        }
        String text = text(value);
        if (text == null) {
            return null;
        }
        try {
            double result = Double.parseDouble(text);
            return Double.isFinite(result) ? result : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Integer integer(Object value) {
        Double number = number(value);
        return number == null ? null : (int) Math.round(number);
    }

    private static Long id(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        String text = text(value);
        if (text == null || !text.matches("\\d+")) {
            return null;
        }
        return Long.parseLong(text);
    }

    private static int quality(Object value) {
        Double number = number(value);
        if (number == null) {
            return 0;
        }
        return (int) Math.max(0, Math.min(100, Math.round(number)));
    }

    private static boolean active(Object value) {
        if (value instanceof Boolean flag) {
            return flag;
        }
        String text = text(value);
        return text == null || !text.equalsIgnoreCase("false");
    }

    private static Instant instant(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof Number number) {
            return Instant.ofEpochMilli(number.longValue());
        }
        String text = text(value);
        if (text == null) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
