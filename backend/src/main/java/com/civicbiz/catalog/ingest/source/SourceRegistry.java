package com.civicbiz.catalog.ingest.source;

import com.civicbiz.catalog.config.PipelineProperties;
import com.civicbiz.catalog.ingest.service.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class SourceRegistry {
    private static final Logger log = LoggerFactory.getLogger(SourceRegistry.class);

    private final List<BusinessSource> sources;
    private final PipelineProperties properties;

    public SourceRegistry(List<BusinessSource> sources, PipelineProperties properties) {
        this.sources = List.copyOf(sources);
        this.properties = properties;
    }

    public List<BusinessSource> enabledSources() {
        List<BusinessSource> enabled = new ArrayList<>();
        for (BusinessSource source : sources) {
            if (!properties.source(source.id()).isEnabled()) {
                log.info("Source {} disabled by configuration", source.id());
                continue;
            }
            if (!source.isConfigured()) {
                log.warn("Source {} has no credentials configured; skipping it for this run", source.id());
                continue;
            }
            enabled.add(source);
        }
        return enabled;
    }

    public List<BusinessSource> requireEnabledSources() {
        List<BusinessSource> enabled = enabledSources();
        if (enabled.isEmpty()) {
            throw new ConfigurationException(
                "No business source is usable: every configured source is disabled or missing credentials"
            );
        }
        return enabled;
    }

    List<String> knownSourceIds() {
        return sources.stream().map(BusinessSource::id).toList();
    }
}
