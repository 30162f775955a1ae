package com.civicbiz.catalog.ingest.dedup;

import com.civicbiz.catalog.config.PipelineProperties;
import com.civicbiz.catalog.ingest.model.BusinessRecord;
import com.civicbiz.catalog.ingest.model.CatalogFilter;
import com.civicbiz.catalog.ingest.persistence.CatalogSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Finds the existing catalog entry an incoming record most likely describes. Only entries in the
 * same state and city are compared.
 */
@Component
public class CatalogIdentityResolver {
    private static final Logger log = LoggerFactory.getLogger(CatalogIdentityResolver.class);

    private final CatalogSink catalog;
    private final DeduplicationEngine deduplicationEngine;
    private final double identityThreshold;

    public CatalogIdentityResolver(
        CatalogSink catalog,
        DeduplicationEngine deduplicationEngine,
        PipelineProperties properties
    ) {
        this.catalog = catalog;
        this.deduplicationEngine = deduplicationEngine;
        this.identityThreshold = properties.getDedup().getIdentityThreshold();
    }

    public Optional<BusinessRecord> resolve(BusinessRecord incoming) {
        if (incoming.state() == null || incoming.city() == null) {
            return Optional.empty();
        }
        BusinessRecord best = null;
        double bestScore = 0.0;
        for (BusinessRecord existing : catalog.query(CatalogFilter.location(incoming.state(), incoming.city()))) {
            double score = deduplicationEngine.similarity(incoming, existing);
            if (score >= identityThreshold && score > bestScore) {
                best = existing;
                bestScore = score;
            }
        }
        if (best != null) {
            log.debug("Matched {} to catalog entry {} ({})", incoming.name(), best.id(), bestScore);
        }
        return Optional.ofNullable(best);
    }
}
