package com.civicbiz.catalog.ingest.service;

import com.civicbiz.catalog.ingest.model.BusinessRecord;
import com.civicbiz.catalog.ingest.model.BusinessStats;
import com.civicbiz.catalog.ingest.model.CatalogFilter;
import com.civicbiz.catalog.ingest.model.ErrorSummary;
import com.civicbiz.catalog.ingest.model.ScrapingMetrics;
import com.civicbiz.catalog.ingest.model.StateConfig;
import com.civicbiz.catalog.ingest.model.SyncLogEntry;
import com.civicbiz.catalog.ingest.persistence.CatalogSink;
import com.civicbiz.catalog.ingest.persistence.ScrapeRunRepository;
import com.civicbiz.catalog.ingest.process.BusinessDataProcessor;
import com.civicbiz.catalog.ingest.quality.DataQualityValidator;
import com.civicbiz.catalog.ingest.registry.StateRegistry;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read side of the monitor: catalog metrics, recent {@code sync_logs} rows and an error digest.
 */
@Service
public class MonitoringService {
    static final int MAX_LOG_LIMIT = 1000;
    static final int MAX_SUMMARY_HOURS = 24 * 30;
    static final int RECENT_ERRORS = 10;
    private static final DateTimeFormatter HOUR = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH").withZone(ZoneOffset.UTC);

    private final CatalogSink catalog;
    private final BusinessDataProcessor processor;
    private final DataQualityValidator validator;
    private final StateRegistry registry;
    private final ScrapeRunRepository runRepository;
    private final ScrapeMonitor monitor;
    private final Clock clock;

    public MonitoringService(
        CatalogSink catalog,
        BusinessDataProcessor processor,
        DataQualityValidator validator,
        StateRegistry registry,
        ScrapeRunRepository runRepository,
        ScrapeMonitor monitor,
        Clock clock
    ) {
        this.catalog = catalog;
        this.processor = processor;
        this.validator = validator;
        this.registry = registry;
        this.runRepository = runRepository;
        this.monitor = monitor;
        this.clock = clock;
    }

    public ScrapingMetrics metrics() {
        Instant now = clock.instant();
        List<BusinessRecord> records = catalog.query(CatalogFilter.activeCatalog());
        BusinessStats stats = processor.stats(records);

        Map<Integer, Integer> byTier = new TreeMap<>();
        int accepted = 0;
        int lastHour = 0;
        Instant hourAgo = now.minus(Duration.ofHours(1));
        for (BusinessRecord record : records) {
            byTier.merge(tierOf(record.state()), 1, Integer::sum);
            if (record.dataQuality() > validator.acceptanceThreshold()) {
                accepted++;
            }
            if (record.createdAt() != null && !record.createdAt().isBefore(hourAgo)) {
                lastHour++;
            }
        }
        int total = stats.total();
        int rejected = total - accepted;
        return new ScrapingMetrics(
            total,
            accepted,
            rejected,
            stats.averageQuality(),
            stats.byCategory(),
            stats.byState(),
            byTier,
            stats.bySource(),
            lastHour / 60.0,
            total == 0 ? 0.0 : rejected * 100.0 / total,
            monitor.counters(),
            monitor.buffered(),
            monitor.droppedEvents(),
            now
        );
    }

    public List<SyncLogEntry> recentLogs(int limit, String level) {
        if (limit < 1 || limit > MAX_LOG_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LOG_LIMIT);
        }
        return runRepository.recentSyncLogs(limit, normalizeLevel(level));
    }

    public ErrorSummary errorSummary(int hours) {
        if (hours < 1 || hours > MAX_SUMMARY_HOURS) {
            throw new IllegalArgumentException("hours must be between 1 and " + MAX_SUMMARY_HOURS);
        }
        List<SyncLogEntry> rows = runRepository.syncLogsWithErrorsSince(clock.instant().minus(Duration.ofHours(hours)));
        Map<String, Integer> bySource = new TreeMap<>();
        Map<String, Integer> byHour = new TreeMap<>();
        int total = 0;
        for (SyncLogEntry row : rows) {
            total += row.errorCount();
            bySource.merge(row.source(), row.errorCount(), Integer::sum);
            byHour.merge(HOUR.format(row.createdAt()), row.errorCount(), Integer::sum);
        }
        return new ErrorSummary(hours, total, bySource, byHour, rows.subList(0, Math.min(RECENT_ERRORS, rows.size())));
    }

    private int tierOf(String state) {
        return registry.find(state).map(StateConfig::tier).orElse(StateRegistry.MAX_TIER);
    }

    private static String normalizeLevel(String level) {
        if (level == null || level.isBlank()) {
            return null;
        }
        String normalized = level.trim().toUpperCase(Locale.ROOT);
        try {
            return ScrapeMonitor.Level.valueOf(normalized).name();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown log level: " + level, e);
        }
    }
}
