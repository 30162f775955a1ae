package com.civicbiz.catalog.ingest.persistence;

import com.civicbiz.catalog.ingest.model.ScrapeRunRequest;
import com.civicbiz.catalog.ingest.model.SyncLogEntry;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
public class ScrapeRunRepository {
    private static final int MAX_NOTES_LENGTH = 1000;
    private static final int MAX_MESSAGE_LENGTH = 2000;
    private static final String SYNC_LOG_COLUMNS =
        "id, source, level, event_count, error_count, last_message, window_start, window_end, created_at";
    private static final RowMapper<SyncLogEntry> SYNC_LOG_ROW = (rs, rowNum) -> new SyncLogEntry(
        rs.getLong("id"),
        rs.getString("source"),
        rs.getString("level"),
        rs.getInt("event_count"),
        rs.getInt("error_count"),
        rs.getString("last_message"),
        toInstant(rs.getTimestamp("window_start")),
        toInstant(rs.getTimestamp("window_end")),
        toInstant(rs.getTimestamp("created_at"))
    );

    private final NamedParameterJdbcTemplate jdbc;

    public ScrapeRunRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public long insertRun(Instant startedAt, String status, String notes, ScrapeRunRequest request) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("startedAt", toTimestamp(startedAt))
            .addValue("status", status)
            .addValue("notes", truncate(notes, MAX_NOTES_LENGTH))
            .addValue("targetCount", request == null ? null : request.targetCount())
            .addValue("tierFilter", request == null ? null : request.tier())
            .addValue("stateFilter", request == null ? null : request.state());

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO scrape_runs (
                    started_at,
                    status,
                    notes,
                    target_count,
                    tier_filter,
                    state_filter
                )
                VALUES (
                    :startedAt,
                    :status,
                    :notes,
                    :targetCount,
                    :tierFilter,
                    :stateFilter
                )
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert scrape run");
        }
        return key.longValue();
    }

    public void completeRun(long runId, Instant finishedAt, String status, String notes, String reportJson) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("finishedAt", toTimestamp(finishedAt))
            .addValue("status", status)
            .addValue("notes", truncate(notes, MAX_NOTES_LENGTH))
            .addValue("reportJson", reportJson);
        jdbc.update(
            """
                UPDATE scrape_runs
                SET finished_at = :finishedAt,
                    status = :status,
                    notes = :notes,
                    report_json = COALESCE(:reportJson, report_json)
                WHERE id = :runId
                """,
            params
        );
    }

    public void insertSyncLog(
        String source,
        String level,
        int eventCount,
        int errorCount,
        String lastMessage,
        Instant windowStart,
        Instant windowEnd
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("source", source)
            .addValue("level", level)
            .addValue("eventCount", eventCount)
            .addValue("errorCount", errorCount)
            .addValue("lastMessage", truncate(lastMessage, MAX_MESSAGE_LENGTH))
            .addValue("windowStart", toTimestamp(windowStart))
            .addValue("windowEnd", toTimestamp(windowEnd))
            .addValue("createdAt", toTimestamp(windowEnd));
        jdbc.update(
            """
                INSERT INTO sync_logs (
                    source, level, event_count, error_count, last_message, window_start, window_end, created_at
                )
                VALUES (
                    :source, :level, :eventCount, :errorCount, :lastMessage, :windowStart, :windowEnd, :createdAt
                )
                """,
            params
        );
    }

    /** Newest rows first; {@code level} narrows to one level when given. */
    public List<SyncLogEntry> recentSyncLogs(int limit, String level) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("limit", limit)
            .addValue("level", level);
        String filter = level == null ? "" : " WHERE level = :level";
        return jdbc.query(
            "SELECT " + SYNC_LOG_COLUMNS + " FROM sync_logs" + filter
                + " ORDER BY created_at DESC, id DESC LIMIT :limit",
            params,
            SYNC_LOG_ROW
        );
    }

    public List<SyncLogEntry> syncLogsWithErrorsSince(Instant since) {
        return jdbc.query(
            "SELECT " + SYNC_LOG_COLUMNS + """
                 FROM sync_logs
                WHERE error_count > 0
                  AND created_at >= :since
                ORDER BY created_at DESC, id DESC
                """,
            new MapSqlParameterSource("since", toTimestamp(since)),
            SYNC_LOG_ROW
        );
    }

    public int deleteSyncLogsOlderThan(Instant cutoff) {
        return jdbc.update(
            "DELETE FROM sync_logs WHERE created_at < :cutoff",
            new MapSqlParameterSource("cutoff", toTimestamp(cutoff))
        );
    }

    private String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private static Instant toInstant(Timestamp value) {
        return value == null ? null : value.toInstant();
    }
}
