package com.civicbiz.catalog.ingest.service;

import com.civicbiz.catalog.ingest.dedup.CatalogIdentityResolver;
import com.civicbiz.catalog.ingest.model.BusinessRecord;
import com.civicbiz.catalog.ingest.persistence.CatalogSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Drains a session's staged records into the catalog. A record that matches an existing entry
 * becomes an update of that entry; anything else is inserted.
 */
@Component
public class CatalogWriter {
    private static final Logger log = LoggerFactory.getLogger(CatalogWriter.class);

    private final CatalogSink catalog;
    private final CatalogIdentityResolver identityResolver;

    public CatalogWriter(CatalogSink catalog, CatalogIdentityResolver identityResolver) {
        this.catalog = catalog;
        this.identityResolver = identityResolver;
    }

    public int write(ScrapeSession session, TargetBudget budget) {
        List<BusinessRecord> batch = session.drainStaged();
        int written = 0;
        int updated = 0;
        for (BusinessRecord record : batch) {
            try {
                Optional<BusinessRecord> existing = identityResolver.resolve(record);
                BusinessRecord toWrite = existing.map(match -> record.withId(match.id())).orElse(record);
                catalog.upsert(toWrite);
                session.recordSuccess();
                written++;
                if (existing.isPresent()) {
                    updated++;
                }
            } catch (RuntimeException e) {
                log.warn("Failed to write {} for {}", record.name(), session.state().stateCode(), e);
                session.recordFailure("write: " + record.name() + ": " + e.getMessage());
                if (budget != null) {
                    budget.release();
                }
            }
        }
        if (!batch.isEmpty()) {
            log.debug("Wrote {}/{} records for {} ({} updates)", written, batch.size(), session.state().stateCode(),
                updated);
        }
        return written;
    }
}
