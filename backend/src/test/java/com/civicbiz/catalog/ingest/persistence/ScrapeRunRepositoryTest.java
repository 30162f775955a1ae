package com.civicbiz.catalog.ingest.persistence;

import com.civicbiz.catalog.ingest.model.ScrapeRunRequest;
import com.civicbiz.catalog.ingest.model.SyncLogEntry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class ScrapeRunRepositoryTest {

    @Autowired
    private ScrapeRunRepository repository;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @Test
    void runIsOpenedAndClosedWithItsReport() {
        Instant startedAt = Instant.parse("2026-03-01T12:00:00Z");
        long runId = repository.insertRun(startedAt, "RUNNING", "tier=1", new ScrapeRunRequest(500, 1, null, false));

        assertEquals("RUNNING", statusOf(runId));

        repository.completeRun(runId, startedAt.plusSeconds(90), "COMPLETED", "x".repeat(1500), "{\"totalSuccess\":42}");

        Map<String, Object> row = jdbc.queryForMap(
            "SELECT status, notes, target_count, tier_filter, report_json FROM scrape_runs WHERE id = :id",
            new MapSqlParameterSource("id", runId)
        );
        assertEquals("COMPLETED", row.get("status"));
        assertEquals(1000, ((String) row.get("notes")).length());
        assertEquals(500, ((Number) row.get("target_count")).intValue());
        assertEquals(1, ((Number) row.get("tier_filter")).intValue());
        assertEquals("{\"totalSuccess\":42}", row.get("report_json"));
    }

    @Test
    void completingWithoutReportKeepsThePreviousOne() {
        long runId = repository.insertRun(Instant.now(), "RUNNING", null, null);
        repository.completeRun(runId, Instant.now(), "RUNNING", null, "{\"partial\":true}");
        repository.completeRun(runId, Instant.now(), "FAILED", "boom", null);

        String report = jdbc.queryForObject(
            "SELECT report_json FROM scrape_runs WHERE id = :id",
            new MapSqlParameterSource("id", runId),
            String.class
        );
        assertEquals("{\"partial\":true}", report);
        assertEquals("FAILED", statusOf(runId));
    }

    @Test
    void syncLogMessagesAreTruncated() {
        String source = "scraper-" + UUID.randomUUID().toString().substring(0, 6);
        Instant windowEnd = Instant.parse("2100-01-01T00:00:00Z");
        repository.insertSyncLog(source, "WARN", 3, 2, "m".repeat(2500), windowEnd.minusSeconds(30), windowEnd);

        SyncLogEntry row = repository.recentSyncLogs(1, null).get(0);
        assertEquals(source, row.source());
        assertEquals(2000, row.lastMessage().length());
        assertEquals(windowEnd, row.createdAt());
    }

    @Test
    void recentSyncLogsAreNewestFirstAndFilterByLevel() {
        String source = "scraper-" + UUID.randomUUID().toString().substring(0, 6);
        Instant base = Instant.parse("2100-02-01T00:00:00Z");
        repository.insertSyncLog(source, "INFO", 12, 0, "state IA finished", base, base.plusSeconds(30));
        repository.insertSyncLog(source, "WARN", 1, 0, "Rate limited: HTTP 429", base, base.plusSeconds(60));
        repository.insertSyncLog(source, "INFO", 4, 0, "state NE finished", base, base.plusSeconds(90));

        List<SyncLogEntry> newest = repository.recentSyncLogs(2, null);
        assertEquals(List.of("state NE finished", "Rate limited: HTTP 429"),
            newest.stream().map(SyncLogEntry::lastMessage).toList());

        List<SyncLogEntry> warnings = repository.recentSyncLogs(5, "WARN");
        assertEquals("Rate limited: HTTP 429", warnings.get(0).lastMessage());
        assertTrue(warnings.stream().allMatch(row -> "WARN".equals(row.level())));
    }

    @Test
    void errorRowsAreSelectedByWindow() {
        String source = "scraper-" + UUID.randomUUID().toString().substring(0, 6);
        Instant base = Instant.parse("2100-03-01T00:00:00Z");
        repository.insertSyncLog(source, "ERROR", 2, 2, "HTTP 500", base, base);
        repository.insertSyncLog(source, "INFO", 9, 0, "state IA finished", base, base.plusSeconds(10));
        repository.insertSyncLog(source, "ERROR", 1, 1, "too old", base.minusSeconds(7260), base.minusSeconds(7200));

        List<SyncLogEntry> errors = repository.syncLogsWithErrorsSince(base.minusSeconds(3600));

        assertEquals(1, errors.size());
        assertEquals("HTTP 500", errors.get(0).lastMessage());
        assertEquals(2, errors.get(0).errorCount());
    }

    @Test
    void rowsPastTheCutoffAreDeleted() {
        String source = "scraper-" + UUID.randomUUID().toString().substring(0, 6);
        Instant old = Instant.parse("1990-06-01T00:00:00Z");
        repository.insertSyncLog(source, "INFO", 1, 0, "expired", old, old);
        repository.insertSyncLog(source, "INFO", 1, 0, "kept", old, old.plusSeconds(86400 * 60L));

        int removed = repository.deleteSyncLogsOlderThan(old.plusSeconds(86400 * 30L));

        assertTrue(removed >= 1);
        List<String> remaining = jdbc.queryForList(
            "SELECT last_message FROM sync_logs WHERE source = :source",
            new MapSqlParameterSource("source", source),
            String.class
        );
        assertEquals(List.of("kept"), remaining);
    }

    private String statusOf(long runId) {
        return jdbc.queryForObject(
            "SELECT status FROM scrape_runs WHERE id = :id",
            new MapSqlParameterSource("id", runId),
            String.class
        );
    }
}
