package com.civicbiz.catalog.ingest.model;

import java.util.List;

public record ScrapePlan(Integer targetCount, List<TierPlan> tiers) {

    public ScrapePlan {
        tiers = tiers == null ? List.of() : List.copyOf(tiers);
    }

    public int totalTarget() {
        return tiers.stream().mapToInt(TierPlan::target).sum();
    }

    public int totalWorkItems() {
        return tiers.stream().mapToInt(TierPlan::workItems).sum();
    }

    public int stateCount() {
        return tiers.stream().mapToInt(tier -> tier.states().size()).sum();
    }

    public record TierPlan(int tier, List<StatePlan> states) {
        public TierPlan {
            states = states == null ? List.of() : List.copyOf(states);
        }

        public int target() {
            return states.stream().mapToInt(StatePlan::target).sum();
        }

        public int workItems() {
            return states.stream().mapToInt(StatePlan::workItems).sum();
        }
    }

    public record StatePlan(StateConfig config, int target, int workItems) {
        public String stateName() {
            return config.stateName();
        }

        public String stateCode() {
            return config.stateCode();
        }
    }
}
