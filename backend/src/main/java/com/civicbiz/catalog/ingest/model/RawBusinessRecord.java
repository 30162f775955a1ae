package com.civicbiz.catalog.ingest.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Source-specific business attributes as an adapter produced them. Keys follow whatever the
 * source calls them; the processor resolves the known aliases.
 */
public record RawBusinessRecord(String source, Map<String, Object> attributes) {

    public RawBusinessRecord {
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static RawBusinessRecord of(String source, Map<String, Object> attributes) {
        return new RawBusinessRecord(source, attributes);
    }

    public Object first(String... keys) {
        for (String key : keys) {
            Object value = attributes.get(key);
            if (value == null) {
                continue;
            }
            if (value instanceof String text && text.isBlank()) {
                continue;
            }
            return value;
        }
        return null;
    }
}
