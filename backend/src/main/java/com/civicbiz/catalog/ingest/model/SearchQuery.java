package com.civicbiz.catalog.ingest.model;

public record SearchQuery(String city, String stateName, String stateCode, String industry) {
}
