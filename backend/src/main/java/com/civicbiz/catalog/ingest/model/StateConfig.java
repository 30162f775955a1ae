package com.civicbiz.catalog.ingest.model;

import java.util.ArrayList;
import java.util.List;

public record StateConfig(
    String stateName,
    String stateCode,
    int tier,
    int businessTarget,
    List<String> cities,
    List<String> industries
) {
    public StateConfig {
        cities = cities == null ? List.of() : List.copyOf(cities);
        industries = industries == null ? List.of() : List.copyOf(industries);
    }

    public int workItemCount() {
        return cities.size() * industries.size();
    }

    public List<WorkItem> workItems() {
        List<WorkItem> items = new ArrayList<>(workItemCount());
        for (String city : cities) {
            for (String industry : industries) {
                items.add(new WorkItem(city, industry));
            }
        }
        return items;
    }

    public record WorkItem(String city, String industry) {
    }
}
