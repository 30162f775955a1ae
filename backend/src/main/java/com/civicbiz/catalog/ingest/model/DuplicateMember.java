package com.civicbiz.catalog.ingest.model;

public record DuplicateMember(long id, String name, String address, String category, double similarityScore) {
}
