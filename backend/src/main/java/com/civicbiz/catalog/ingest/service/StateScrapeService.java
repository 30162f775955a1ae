package com.civicbiz.catalog.ingest.service;

import com.civicbiz.catalog.config.PipelineProperties;
import com.civicbiz.catalog.ingest.model.BusinessRecord;
import com.civicbiz.catalog.ingest.model.RawBusinessRecord;
import com.civicbiz.catalog.ingest.model.SearchQuery;
import com.civicbiz.catalog.ingest.model.SourceCandidate;
import com.civicbiz.catalog.ingest.model.StateConfig;
import com.civicbiz.catalog.ingest.model.StateResult;
import com.civicbiz.catalog.ingest.model.ValidationResult;
import com.civicbiz.catalog.ingest.process.BusinessDataProcessor;
import com.civicbiz.catalog.ingest.quality.DataQualityValidator;
import com.civicbiz.catalog.ingest.source.BusinessSource;
import com.civicbiz.catalog.ingest.source.RateLimitedException;
import com.civicbiz.catalog.ingest.source.SourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Scrapes one state: every city and industry pair, in batches, through every enabled source.
 * Failures are recorded on the state's result and never thrown to the caller.
 */
@Service
public class StateScrapeService {
    private static final Logger log = LoggerFactory.getLogger(StateScrapeService.class);

    private final BusinessDataProcessor processor;
    private final DataQualityValidator validator;
    private final CatalogWriter writer;
    private final ScrapeMonitor monitor;
    private final PipelineProperties properties;

    public StateScrapeService(
        BusinessDataProcessor processor,
        DataQualityValidator validator,
        CatalogWriter writer,
        ScrapeMonitor monitor,
        PipelineProperties properties
    ) {
        this.processor = processor;
        this.validator = validator;
        this.writer = writer;
        this.monitor = monitor;
        this.properties = properties;
    }

    public StateResult scrape(StateConfig state, ScrapeRunContext context) {
        ScrapeSession session = new ScrapeSession(state);
        List<StateConfig.WorkItem> items = state.workItems();
        int batchSize = properties.getScraping().getBatchSize();
        log.info("Scraping {} ({} work items, target {})", state.stateName(), items.size(), state.businessTarget());

        for (int start = 0; start < items.size(); start += batchSize) {
            if (context.budget().isExhausted()) {
                log.info("Target count reached; skipping remaining work for {}", state.stateCode());
                break;
            }
            int end = Math.min(items.size(), start + batchSize);
            for (StateConfig.WorkItem item : items.subList(start, end)) {
                if (context.budget().isExhausted()) {
                    break;
                }
                processWorkItem(item, session, context);
            }
            writer.write(session, context.budget());

            boolean lastBatch = end >= items.size();
            if (!lastBatch && !context.budget().isExhausted() && !pauseBetweenBatches(session)) {
                break;
            }
        }

        StateResult result = session.toResult(context.throttle() == null ? List.of() : context.throttle().disabledSources());
        monitor.stateCompleted(result);
        return result;
    }

    private void processWorkItem(StateConfig.WorkItem item, ScrapeSession session, ScrapeRunContext context) {
        StateConfig state = session.state();
        SearchQuery query = new SearchQuery(item.city(), state.stateName(), state.stateCode(), item.industry());
        for (BusinessSource source : context.sources()) {
            if (isDisabled(source, context)) {
                continue;
            }
            try {
                List<SourceCandidate> candidates = context.retryPolicy()
                    .execute(source.id(), () -> source.fetchCandidates(query), context.throttle());
                log.debug("{} returned {} candidates for {} in {}", source.id(), candidates.size(), item.industry(),
                    item.city());
                for (SourceCandidate candidate : candidates) {
                    if (context.budget().isExhausted() || isDisabled(source, context)) {
                        return;
                    }
                    fetchAndStage(source, candidate, session, context);
                }
            } catch (SourceException e) {
                recordSourceFailure(source, query, e, session);
            } catch (RuntimeException e) {
                log.warn("Unexpected failure from {} for {} in {}", source.id(), item.industry(), item.city(), e);
                session.recordError(source.id() + " " + describe(query) + ": " + e.getClass().getSimpleName()
                    + ": " + e.getMessage());
                monitor.sourceError(source.id(), e.getMessage());
            }
        }
    }

    private void fetchAndStage(
        BusinessSource source,
        SourceCandidate candidate,
        ScrapeSession session,
        ScrapeRunContext context
    ) {
        Optional<RawBusinessRecord> raw;
        try {
            raw = context.retryPolicy().execute(source.id(), () -> source.fetchDetail(candidate), context.throttle());
        } catch (SourceException e) {
            recordSourceFailure(source, candidate.query(), e, session);
            return;
        }
        raw.ifPresent(record -> stage(record, session, context));
    }

    void stage(RawBusinessRecord raw, ScrapeSession session, ScrapeRunContext context) {
        BusinessRecord record = processor.clean(raw);
        if (record.state() == null) {
            record = record.withState(session.state().stateCode());
        }
        if (!session.admit(record)) {
            return;
        }
        ValidationResult validation = validator.validate(record);
        if (!validator.isAccepted(validation)) {
            String reasons = validation.errors().isEmpty()
                ? "score " + validation.score() + " not above " + validator.acceptanceThreshold()
                : String.join("; ", validation.errors());
            session.recordFailure("validation: " + (record.name() == null ? "(unnamed)" : record.name()) + ": " + reasons);
            return;
        }
        session.claim(record);
        if (!context.budget().tryReserve()) {
            return;
        }
        session.stage(record.withDataQuality(validation.score()));
    }

    private void recordSourceFailure(BusinessSource source, SearchQuery query, SourceException e, ScrapeSession session) {
        String message = e.getMessage();
        session.recordError(source.id() + " " + describe(query) + ": " + message);
        if (e instanceof RateLimitedException) {
            monitor.rateLimited(source.id(), message);
        } else {
            monitor.sourceError(source.id(), message);
        }
    }

    private boolean pauseBetweenBatches(ScrapeSession session) {
        long delay = properties.getScraping().getRateLimitDelayMs();
        if (delay <= 0) {
            return true;
        }
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted between batches for {}", session.state().stateCode());
            session.recordError("interrupted between batches");
            return false;
        }
    }

    private boolean isDisabled(BusinessSource source, ScrapeRunContext context) {
        return context.throttle() != null && context.throttle().isDisabled(source.id());
    }

    private static String describe(SearchQuery query) {
        return query == null ? "" : query.industry() + " in " + query.city();
    }
}
