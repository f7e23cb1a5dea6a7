package com.timesync.reconciliation.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable issue entry produced during a run.
 *
 * @param category    what kind of issue
 * @param identity    event identity when known
 * @param source      side the snapshot was taken from
 * @param snapshot    full field snapshot of the offending record
 * @param message     human readable description
 * @param timestamp   when the issue was recorded
 */
public record ConflictRecord(
    ConflictCategory category,
    UUID identity,
    EventSource source,
    Map<String, Object> snapshot,
    String message,
    Instant timestamp
) {

    public ConflictRecord {
        snapshot = snapshot == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(snapshot));
    }
}
