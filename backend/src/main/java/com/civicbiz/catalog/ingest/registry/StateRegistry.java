package com.civicbiz.catalog.ingest.registry;

import com.civicbiz.catalog.config.PipelineProperties;
import com.civicbiz.catalog.ingest.model.StateConfig;
import com.civicbiz.catalog.ingest.process.StateCodes;
import com.civicbiz.catalog.ingest.service.ConfigurationException;
import com.civicbiz.catalog.ingest.util.TextNormalizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read-only table of the states to scrape, keyed by state code. Loaded once at startup; a
 * malformed or contradictory registry document fails the application context.
 */
@Component
public class StateRegistry {
    private static final Logger log = LoggerFactory.getLogger(StateRegistry.class);
    public static final int MIN_TIER = 1;
    public static final int MAX_TIER = 4;

    private final Map<String, StateConfig> states;

    @Autowired
    public StateRegistry(PipelineProperties properties, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this(load(properties.getRegistry().getLocation(), resourceLoader, objectMapper));
    }

    StateRegistry(List<RegistryEntry> entries) {
        this.states = Collections.unmodifiableMap(build(entries));
        log.info("State registry loaded: {} states across tiers {}", states.size(), tiers());
    }

    public static StateRegistry of(List<RegistryEntry> entries) {
        return new StateRegistry(entries);
    }

    public List<StateConfig> all() {
        return List.copyOf(states.values());
    }

    public Optional<StateConfig> find(String nameOrCode) {
        if (nameOrCode == null || nameOrCode.isBlank()) {
            return Optional.empty();
        }
        return StateCodes.lookup(nameOrCode).map(states::get);
    }

    public StateConfig require(String nameOrCode) {
        return find(nameOrCode)
            .orElseThrow(() -> new ConfigurationException("Unknown state: " + nameOrCode));
    }

    public List<Integer> tiers() {
        Set<Integer> tiers = new TreeSet<>();
        for (StateConfig config : states.values()) {
            tiers.add(config.tier());
        }
        return List.copyOf(tiers);
    }

    public List<StateConfig> statesForTier(int tier) {
        List<StateConfig> result = new ArrayList<>();
        for (StateConfig config : states.values()) {
            if (config.tier() == tier) {
                result.add(config);
            }
        }
        return result;
    }

    private static List<RegistryEntry> load(String location, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new ConfigurationException("State registry not found at " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            RegistryDocument document = objectMapper.readValue(in, RegistryDocument.class);
            if (document == null || document.states() == null || document.states().isEmpty()) {
                throw new ConfigurationException("State registry at " + location + " lists no states");
            }
            return document.states();
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read state registry at " + location, e);
        }
    }

    private static Map<String, StateConfig> build(List<RegistryEntry> entries) {
        Map<String, StateConfig> byCode = new LinkedHashMap<>();
        for (RegistryEntry entry : entries) {
            StateConfig config = validate(entry);
            StateConfig existing = byCode.get(config.stateCode());
            if (existing == null) {
                byCode.put(config.stateCode(), config);
                continue;
            }
            if (existing.tier() != config.tier() || existing.businessTarget() != config.businessTarget()) {
                throw new ConfigurationException(
                    "Conflicting registry entries for " + config.stateName()
                        + ": tier " + existing.tier() + "/" + config.tier()
                        + ", target " + existing.businessTarget() + "/" + config.businessTarget()
                );
            }
            log.debug("Merging duplicate registry entry for {}", config.stateName());
            byCode.put(config.stateCode(), new StateConfig(
                existing.stateName(),
                existing.stateCode(),
                existing.tier(),
                existing.businessTarget(),
                union(existing.cities(), config.cities()),
                union(existing.industries(), config.industries())
            ));
        }
        // keep tier order stable regardless of document order
        List<StateConfig> ordered = new ArrayList<>(byCode.values());
        ordered.sort((a, b) -> Integer.compare(a.tier(), b.tier()));
        Map<String, StateConfig> result = new LinkedHashMap<>();
        for (StateConfig config : ordered) {
            result.put(config.stateCode(), config);
        }
        return result;
    }

    static StateConfig validate(RegistryEntry entry) {
        String name = TextNormalizer.clean(entry.stateName());
        if (name == null) {
            throw new ConfigurationException("Registry entry without a state name");
        }
        String code = entry.stateCode() == null
            ? StateCodes.lookup(name).orElse(null)
            : StateCodes.lookup(entry.stateCode()).orElse(null);
        if (code == null) {
            throw new ConfigurationException("Unknown state in registry: " + name);
        }
        if (entry.tier() == null || entry.tier() < MIN_TIER || entry.tier() > MAX_TIER) {
            throw new ConfigurationException(
                "Tier for " + name + " must be between " + MIN_TIER + " and " + MAX_TIER + ": " + entry.tier());
        }
        if (entry.businessTarget() == null || entry.businessTarget() <= 0) {
            throw new ConfigurationException("Business target for " + name + " must be positive");
        }
        List<String> cities = cleanList(entry.cities());
        List<String> industries = cleanList(entry.industries());
        if (cities.isEmpty() || industries.isEmpty()) {
            throw new ConfigurationException("Registry entry for " + name + " needs at least one city and industry");
        }
        return new StateConfig(name, code, entry.tier(), entry.businessTarget(), cities, industries);
    }

    private static List<String> cleanList(List<String> values) {
        if (values == null) {
            return List.of();
        }
        Map<String, String> unique = new LinkedHashMap<>();
        for (String value : values) {
            String cleaned = TextNormalizer.clean(value);
            if (cleaned != null) {
                unique.putIfAbsent(cleaned.toLowerCase(Locale.ROOT), cleaned);
            }
        }
        return List.copyOf(unique.values());
    }

    private static List<String> union(List<String> first, List<String> second) {
        Set<String> merged = new LinkedHashSet<>(first);
        merged.addAll(second);
        return cleanList(new ArrayList<>(merged));
    }

    public record RegistryEntry(
        String stateName,
        String stateCode,
        Integer tier,
        Integer businessTarget,
        List<String> cities,
        List<String> industries
    ) {
    }

    record RegistryDocument(List<RegistryEntry> states) {
    }
}
