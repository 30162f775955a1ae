package com.civicbiz.catalog.ingest.model;

import java.time.Instant;

/** One persisted monitor row: the events of one source and level over a flush window. */
public record SyncLogEntry(
    long id,
    String source,
    String level,
    int eventCount,
    int errorCount,
    String lastMessage,
    Instant windowStart,
    Instant windowEnd,
    Instant createdAt
) {
}
