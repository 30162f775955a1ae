package com.civicbiz.catalog.ingest.model;

public record CatalogFilter(String state, String city, boolean activeOnly, Integer limit) {

    public static CatalogFilter activeCatalog() {
        return new CatalogFilter(null, null, true, null);
    }

    public static CatalogFilter location(String state, String city) {
        return new CatalogFilter(state, city, true, null);
    }
}
