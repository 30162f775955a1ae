package com.civicbiz.catalog.ingest.service;

import com.civicbiz.catalog.config.PipelineProperties;
import com.civicbiz.catalog.ingest.http.SourceRateLimiter;
import com.civicbiz.catalog.ingest.model.ScrapePlan;
import com.civicbiz.catalog.ingest.model.ScrapeRunReport;
import com.civicbiz.catalog.ingest.model.ScrapeRunRequest;
import com.civicbiz.catalog.ingest.model.StateResult;
import com.civicbiz.catalog.ingest.model.TierResult;
import com.civicbiz.catalog.ingest.persistence.ScrapeRunRepository;
import com.civicbiz.catalog.ingest.source.BusinessSource;
import com.civicbiz.catalog.ingest.source.SourceRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

@Service
public class ScrapeOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(ScrapeOrchestratorService.class);

    public static final String STATUS_RUNNING = "RUNNING";
    public static final String STATUS_COMPLETED = "COMPLETED";
    public static final String STATUS_COMPLETED_WITH_ERRORS = "COMPLETED_WITH_ERRORS";
    public static final String STATUS_FAILED = "FAILED";
    public static final String STATUS_DRY_RUN = "DRY_RUN";

    private final ScrapePlanner planner;
    private final SourceRegistry sourceRegistry;
    private final StateScrapeService stateScrapeService;
    private final ScrapeRunRepository runRepository;
    private final SourceRateLimiter rateLimiter;
    private final ScrapeMonitor monitor;
    private final ExecutorService scrapeExecutor;
    private final PipelineProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ScrapeOrchestratorService(
        ScrapePlanner planner,
        SourceRegistry sourceRegistry,
        StateScrapeService stateScrapeService,
        ScrapeRunRepository runRepository,
        SourceRateLimiter rateLimiter,
        ScrapeMonitor monitor,
        @Qualifier("scrapeExecutor") ExecutorService scrapeExecutor,
        PipelineProperties properties,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        this.planner = planner;
        this.sourceRegistry = sourceRegistry;
        this.stateScrapeService = stateScrapeService;
        this.runRepository = runRepository;
        this.rateLimiter = rateLimiter;
        this.monitor = monitor;
        this.scrapeExecutor = scrapeExecutor;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public ScrapePlan preview(ScrapeRunRequest request) {
        return planner.plan(request);
    }

    public ScrapeRunReport run(ScrapeRunRequest request) {
        ScrapeRunRequest safeRequest = request == null ? ScrapeRunRequest.all() : request;
        ScrapePlan plan = planner.plan(safeRequest);
        Instant startedAt = clock.instant();

        if (safeRequest.dryRun()) {
            List<String> usable = sourceRegistry.enabledSources().stream().map(BusinessSource::id).toList();
            log.info(
                "Dry run: {} tiers, {} states, {} work items, overall target {}, sources {}",
                plan.tiers().size(),
                plan.stateCount(),
                plan.totalWorkItems(),
                overallTarget(plan),
                usable
            );
            return report(null, STATUS_DRY_RUN, true, startedAt, clock.instant(), List.of(), plan);
        }

        List<BusinessSource> sources = sourceRegistry.requireEnabledSources();
        long runId = runRepository.insertRun(startedAt, STATUS_RUNNING, "scrape started", safeRequest);
        monitor.scrapeStarted(runId, plan.stateCount(), overallTarget(plan));

        String status = STATUS_FAILED;
        String notes = "scrape_failed";
        List<TierResult> tiers = new ArrayList<>();
        ScrapeRunReport report = null;
        try {
            TargetBudget budget = safeRequest.hasTargetCap()
                ? TargetBudget.capped(safeRequest.targetCount())
                : TargetBudget.unlimited();
            SourceThrottleTracker throttle = new SourceThrottleTracker(
                rateLimiter,
                properties.getRateLimit().getBackoffSeconds(),
                properties.getRateLimit().getDisableAfterSignals()
            );
            ScrapeRunContext context = new ScrapeRunContext(runId, sources, RetryPolicy.from(properties), throttle, budget);

            boolean hadErrors = false;
            for (ScrapePlan.TierPlan tierPlan : plan.tiers()) {
                if (budget.isExhausted()) {
                    log.info("Target count {} reached before tier {}", budget.limit(), tierPlan.tier());
                    break;
                }
                TierResult tierResult = runTier(tierPlan, context);
                tiers.add(tierResult);
                if (!tierResult.errors().isEmpty()) {
                    hadErrors = true;
                }
                log.info(
                    "Tier {} finished: target={}, processed={}, success={}, failed={}",
                    tierResult.tier(),
                    tierResult.target(),
                    tierResult.processed(),
                    tierResult.success(),
                    tierResult.failed()
                );
            }
            status = hadErrors ? STATUS_COMPLETED_WITH_ERRORS : STATUS_COMPLETED;
            notes = "tiers=" + tiers.size() + ", accepted=" + budget.reserved();
        } catch (RuntimeException e) {
            log.warn("Scrape run {} failed", runId, e);
            status = STATUS_FAILED;
            notes = "exception=" + e.getClass().getSimpleName();
        } finally {
            report = report(runId, status, false, startedAt, clock.instant(), tiers, plan);
            runRepository.completeRun(runId, report.finishedAt(), status, notes, toJson(report));
        }
        monitor.scrapeCompleted(report);
        monitor.flush();
        return report;
    }

    private TierResult runTier(ScrapePlan.TierPlan tierPlan, ScrapeRunContext context) {
        List<ScrapePlan.StatePlan> states = tierPlan.states();
        log.info("Starting tier {} with {} states", tierPlan.tier(), states.size());
        List<CompletableFuture<StateResult>> futures = new ArrayList<>();
        for (ScrapePlan.StatePlan state : states) {
            futures.add(CompletableFuture.supplyAsync(
                () -> stateScrapeService.scrape(state.config(), context),
                scrapeExecutor
            ));
        }

        List<StateResult> results = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            ScrapePlan.StatePlan state = states.get(i);
            try {
                results.add(futures.get(i).join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.warn("State scrape failed for {}", state.stateName(), cause);
                monitor.sourceError(ScrapeMonitor.PIPELINE_SOURCE, "State " + state.stateCode() + " failed: "
                    + cause.getMessage());
                results.add(StateResult.failed(
                    state.config(),
                    "state_failed: " + cause.getClass().getSimpleName() + ": " + cause.getMessage()
                ));
            }
        }
        return TierResult.of(tierPlan.tier(), results);
    }

    private ScrapeRunReport report(
        Long runId,
        String status,
        boolean dryRun,
        Instant startedAt,
        Instant finishedAt,
        List<TierResult> tiers,
        ScrapePlan plan
    ) {
        int processed = 0;
        int success = 0;
        int failed = 0;
        for (TierResult tier : tiers) {
            processed += tier.processed();
            success += tier.success();
            failed += tier.failed();
        }
        int overallTarget = overallTarget(plan);
        return new ScrapeRunReport(
            runId,
            status,
            dryRun,
            startedAt,
            finishedAt,
            Duration.between(startedAt, finishedAt).toMillis(),
            plan.stateCount(),
            overallTarget,
            processed,
            success,
            failed,
            percent(success, processed),
            percent(processed, overallTarget),
            tiers,
            plan
        );
    }

    static int overallTarget(ScrapePlan plan) {
        int total = plan.totalTarget();
        if (plan.targetCount() != null && plan.targetCount() > 0) {
            return Math.min(total, plan.targetCount());
        }
        return total;
    }

    private static double percent(int part, int whole) {
        if (whole <= 0) {
            return 0.0;
        }
        return Math.round(part * 10000.0 / whole) / 100.0;
    }

    private String toJson(ScrapeRunReport report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize report for scrape run {}", report.runId(), e);
            return null;
        }
    }
}
