package com.civicbiz.catalog.ingest.service;

import com.civicbiz.catalog.ingest.model.ScrapePlan;
import com.civicbiz.catalog.ingest.model.ScrapeRunRequest;
import com.civicbiz.catalog.ingest.model.StateConfig;
import com.civicbiz.catalog.ingest.registry.StateRegistry;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class ScrapePlanner {
    private final StateRegistry registry;

    public ScrapePlanner(StateRegistry registry) {
        this.registry = registry;
    }

    public ScrapePlan plan(ScrapeRunRequest request) {
        ScrapeRunRequest safeRequest = request == null ? ScrapeRunRequest.all() : request;
        Integer tierFilter = safeRequest.tier();
        if (tierFilter != null && (tierFilter < StateRegistry.MIN_TIER || tierFilter > StateRegistry.MAX_TIER)) {
            throw new ConfigurationException(
                "Tier must be between " + StateRegistry.MIN_TIER + " and " + StateRegistry.MAX_TIER + ": " + tierFilter);
        }
        if (safeRequest.targetCount() != null && safeRequest.targetCount() <= 0) {
            throw new ConfigurationException("Target count must be positive: " + safeRequest.targetCount());
        }
        StateConfig stateFilter = null;
        if (safeRequest.state() != null && !safeRequest.state().isBlank()) {
            stateFilter = registry.require(safeRequest.state());
            if (tierFilter != null && stateFilter.tier() != tierFilter) {
                throw new ConfigurationException(
                    stateFilter.stateName() + " is a tier " + stateFilter.tier() + " state, not tier " + tierFilter);
            }
        }

        List<ScrapePlan.TierPlan> tiers = new ArrayList<>();
        for (int tier : registry.tiers()) {
            if (tierFilter != null && tier != tierFilter) {
                continue;
            }
            List<ScrapePlan.StatePlan> states = new ArrayList<>();
            for (StateConfig config : registry.statesForTier(tier)) {
                if (stateFilter != null && !stateFilter.stateCode().equals(config.stateCode())) {
                    continue;
                }
                states.add(new ScrapePlan.StatePlan(config, config.businessTarget(), config.workItemCount()));
            }
            if (!states.isEmpty()) {
                tiers.add(new ScrapePlan.TierPlan(tier, states));
            }
        }
        return new ScrapePlan(safeRequest.targetCount(), tiers);
    }
}
