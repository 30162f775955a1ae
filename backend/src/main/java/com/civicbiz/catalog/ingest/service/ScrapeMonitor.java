package com.civicbiz.catalog.ingest.service;

import com.civicbiz.catalog.config.PipelineProperties;
import com.civicbiz.catalog.ingest.model.ScrapeRunReport;
import com.civicbiz.catalog.ingest.model.StateResult;
import com.civicbiz.catalog.ingest.persistence.ScrapeRunRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Pipeline event sink. Every event goes to the application log straight away and is buffered;
 * the buffer is written to {@code sync_logs} as per-source, per-level counters on a schedule and
 * whenever it fills up.
 *
 * <p>A failed write keeps the events for the next attempt, up to {@link #RETAINED_BUFFERS} times the
 * buffer limit; older events beyond that are dropped and counted. Until the next scheduled flush
 * after a failure, a full buffer no longer triggers a write from the logging thread. The same
 * scheduler deletes rows older than the retention window.
 */
@Component
public class ScrapeMonitor {
    private static final Logger log = LoggerFactory.getLogger(ScrapeMonitor.class);
    static final String PIPELINE_SOURCE = "pipeline";
    static final int RETAINED_BUFFERS = 10;

    public enum Level {
        DEBUG,
        INFO,
        WARN,
        ERROR
    }

    public record MonitorEvent(Instant at, Level level, String source, String message, Map<String, Object> metadata) {
        public MonitorEvent {
            metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        }

        boolean isError() {
            return level == Level.ERROR || metadata.containsKey("error");
        }
    }

    private final ScrapeRunRepository repository;
    private final Clock clock;
    private final int flushIntervalSeconds;
    private final int bufferLimit;
    private final int retentionDays;
    private final int retentionSweepMinutes;
    private final List<MonitorEvent> buffer = new ArrayList<>();
    private final Map<String, Long> counters = new TreeMap<>();
    private long droppedEvents;
    private Instant inlineFlushBlockedUntil;
    private ScheduledExecutorService flusher;

    @Autowired
    public ScrapeMonitor(ScrapeRunRepository repository, PipelineProperties properties, Clock clock) {
        this(
            repository,
            clock,
            properties.getMonitoring().getFlushIntervalSeconds(),
            properties.getMonitoring().getBufferLimit(),
            properties.getMonitoring().getRetentionDays(),
            properties.getMonitoring().getRetentionSweepMinutes()
        );
    }

    ScrapeMonitor(ScrapeRunRepository repository, Clock clock, int flushIntervalSeconds, int bufferLimit) {
        this(repository, clock, flushIntervalSeconds, bufferLimit, 30, 60);
    }

    ScrapeMonitor(
        ScrapeRunRepository repository,
        Clock clock,
        int flushIntervalSeconds,
        int bufferLimit,
        int retentionDays,
        int retentionSweepMinutes
    ) {
        this.repository = repository;
        this.clock = clock;
        this.flushIntervalSeconds = flushIntervalSeconds;
        this.bufferLimit = bufferLimit;
        this.retentionDays = retentionDays;
        this.retentionSweepMinutes = retentionSweepMinutes;
    }

    @PostConstruct
    void startFlusher() {
        flusher = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "scrape-monitor-flush");
            thread.setDaemon(true);
            return thread;
        });
        flusher.scheduleAtFixedRate(this::flush, flushIntervalSeconds, flushIntervalSeconds, TimeUnit.SECONDS);
        flusher.scheduleAtFixedRate(this::sweepExpired, retentionSweepMinutes, retentionSweepMinutes, TimeUnit.MINUTES);
    }

    @PreDestroy
    void shutdown() {
        if (flusher != null) {
            flusher.shutdownNow();
        }
        flush();
    }

    public void log(Level level, String source, String message, Map<String, Object> metadata) {
        String safeSource = source == null ? PIPELINE_SOURCE : source;
        MonitorEvent event = new MonitorEvent(clock.instant(), level, safeSource, message, metadata);
        writeThrough(event);
        boolean flushNow;
        synchronized (buffer) {
            buffer.add(event);
            counters.merge(safeSource + ":" + level, 1L, Long::sum);
            trimToRetained();
            flushNow = buffer.size() >= bufferLimit && !isBackingOff();
        }
        if (flushNow) {
            flush();
        }
    }

    public void scrapeStarted(Long runId, int states, int overallTarget) {
        log(Level.INFO, PIPELINE_SOURCE, "Scrape run started", metadata(
            "runId", runId, "states", states, "overallTarget", overallTarget));
    }

    public void scrapeCompleted(ScrapeRunReport report) {
        log(Level.INFO, PIPELINE_SOURCE, "Scrape run finished with status " + report.status(), metadata(
            "runId", report.runId(),
            "processed", report.totalProcessed(),
            "success", report.totalSuccess(),
            "failed", report.totalFailed(),
            "durationMs", report.durationMs()));
    }

    public void stateCompleted(StateResult result) {
        Level level = result.hasErrors() ? Level.WARN : Level.INFO;
        log(level, PIPELINE_SOURCE, "State " + result.stateCode() + " finished", metadata(
            "processed", result.processed(),
            "success", result.success(),
            "failed", result.failed(),
            "duplicatesSkipped", result.duplicatesSkipped()));
    }

    public void rateLimited(String sourceId, String message) {
        log(Level.WARN, sourceId, "Rate limited: " + message, metadata("signal", "rate_limit"));
    }

    public void sourceError(String sourceId, String message) {
        log(Level.ERROR, sourceId, message, metadata("error", message));
    }

    /** Writes buffered events as aggregated rows. Returns the number of events written. */
    public int flush() {
        List<MonitorEvent> pending;
        synchronized (buffer) {
            if (buffer.isEmpty()) {
                return 0;
            }
            pending = new ArrayList<>(buffer);
            buffer.clear();
        }
        try {
            for (Aggregate aggregate : aggregate(pending).values()) {
                repository.insertSyncLog(
                    aggregate.source,
                    aggregate.level.name(),
                    aggregate.events,
                    aggregate.errors,
                    aggregate.lastMessage,
                    aggregate.windowStart,
                    aggregate.windowEnd
                );
            }
            synchronized (buffer) {
                inlineFlushBlockedUntil = null;
            }
            return pending.size();
        } catch (RuntimeException e) {
            long dropped;
            synchronized (buffer) {
                buffer.addAll(0, pending);
                dropped = trimToRetained();
                inlineFlushBlockedUntil = clock.instant().plusSeconds(flushIntervalSeconds);
            }
            log.warn("Failed to flush {} monitor events; keeping them for the next flush ({} oldest dropped)",
                pending.size(), dropped, e);
            return 0;
        }
    }

    /** Deletes persisted rows older than the retention window. Returns the number of rows removed. */
    public int sweepExpired() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(retentionDays));
        try {
            int removed = repository.deleteSyncLogsOlderThan(cutoff);
            if (removed > 0) {
                log.info("Removed {} sync log rows older than {} days", removed, retentionDays);
            }
            return removed;
        } catch (RuntimeException e) {
            log.warn("Failed to remove sync log rows older than {}", cutoff, e);
            return 0;
        }
    }

    public Map<String, Long> counters() {
        synchronized (buffer) {
            return Map.copyOf(counters);
        }
    }

    public long droppedEvents() {
        synchronized (buffer) {
            return droppedEvents;
        }
    }

    public int buffered() {
        synchronized (buffer) {
            return buffer.size();
        }
    }

    private int trimToRetained() {
        int excess = buffer.size() - bufferLimit * RETAINED_BUFFERS;
        if (excess <= 0) {
            return 0;
        }
        buffer.subList(0, excess).clear();
        droppedEvents += excess;
        return excess;
    }

    private boolean isBackingOff() {
        return inlineFlushBlockedUntil != null && clock.instant().isBefore(inlineFlushBlockedUntil);
    }

    private Map<String, Aggregate> aggregate(List<MonitorEvent> events) {
        Map<String, Aggregate> aggregates = new LinkedHashMap<>();
        for (MonitorEvent event : events) {
            Aggregate aggregate = aggregates.computeIfAbsent(
                event.source() + ":" + event.level(),
                ignored -> new Aggregate(event.source(), event.level(), event.at())
            );
            aggregate.events++;
            if (event.isError()) {
                aggregate.errors++;
            }
            aggregate.lastMessage = event.message();
            if (event.at().isAfter(aggregate.windowEnd)) {
                aggregate.windowEnd = event.at();
            }
        }
        return aggregates;
    }

    private void writeThrough(MonitorEvent event) {
        String pattern = "[{}] {} {}";
        Object metadata = event.metadata().isEmpty() ? "" : event.metadata();
        switch (event.level()) {
            case DEBUG -> log.debug(pattern, event.source(), event.message(), metadata);
            case INFO -> log.info(pattern, event.source(), event.message(), metadata);
            case WARN -> log.warn(pattern, event.source(), event.message(), metadata);
            case ERROR -> log.error(pattern, event.source(), event.message(), metadata);
        }
    }

    private static Map<String, Object> metadata(Object... keyValues) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                metadata.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
            }
        }
        return metadata;
    }

    private static final class Aggregate {
        private final String source;
        private final Level level;
        private final Instant windowStart;
        private Instant windowEnd;
        private int events;
        private int errors;
        private String lastMessage;

        private Aggregate(String source, Level level, Instant at) {
            this.source = source;
            this.level = level;
            this.windowStart = at;
            this.windowEnd = at;
        }
    }
}
