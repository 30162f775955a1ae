package com.civicbiz.catalog.ingest.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public record BusinessRecord(
    Long id,
    String name,
    String description,
    String category,
    String address,
    String city,
    String state,
    String zipCode,
    String phone,
    String email,
    String website,
    Double latitude,
    Double longitude,
    Double rating,
    Integer reviewCount,
    String imageUrl,
    int dataQuality,
    String source,
    Instant createdAt,
    Instant updatedAt,
    boolean isActive
) {
    public BusinessRecord withId(Long newId) {
        return new BusinessRecord(newId, name, description, category, address, city, state, zipCode, phone, email,
            website, latitude, longitude, rating, reviewCount, imageUrl, dataQuality, source, createdAt, updatedAt,
            isActive);
    }

    public BusinessRecord withDataQuality(int score) {
        return new BusinessRecord(id, name, description, category, address, city, state, zipCode, phone, email,
            website, latitude, longitude, rating, reviewCount, imageUrl, score, source, createdAt, updatedAt,
            isActive);
    }

    public BusinessRecord withState(String stateCode) {
        return new BusinessRecord(id, name, description, category, address, city, stateCode, zipCode, phone, email,
            website, latitude, longitude, rating, reviewCount, imageUrl, dataQuality, source, createdAt, updatedAt,
            isActive);
    }

    public RawBusinessRecord toRawRecord() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("id", id);
        attributes.put("name", name);
        attributes.put("description", description);
        attributes.put("category", category);
        attributes.put("address", address);
        attributes.put("city", city);
        attributes.put("state", state);
        attributes.put("zipCode", zipCode);
        attributes.put("phone", phone);
        attributes.put("email", email);
        attributes.put("website", website);
        attributes.put("latitude", latitude);
        attributes.put("longitude", longitude);
        attributes.put("rating", rating);
        attributes.put("reviewCount", reviewCount);
        attributes.put("imageUrl", imageUrl);
        attributes.put("dataQuality", dataQuality);
        attributes.put("createdAt", createdAt);
        attributes.put("updatedAt", updatedAt);
        attributes.put("isActive", isActive);
        return new RawBusinessRecord(source, attributes);
    }
}
