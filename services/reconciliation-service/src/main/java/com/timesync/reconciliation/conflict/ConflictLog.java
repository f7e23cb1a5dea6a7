package com.timesync.reconciliation.conflict;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.timesync.reconciliation.domain.ConflictCategory;
import com.timesync.reconciliation.domain.ConflictRecord;
import com.timesync.reconciliation.domain.EventSource;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Run-scoped accumulator of {@link ConflictRecord}s. Every record is logged at
 * WARN when it is added and kept for the reporters at the end of the run.
 */
@Slf4j
public class ConflictLog {

    private static final TypeReference<Map<String, Object>> SNAPSHOT_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final List<ConflictRecord> records = new ArrayList<>();

    public ConflictLog(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Records an issue with a field snapshot of {@code offendingRecord}.
     */
    public ConflictRecord record(ConflictCategory category, UUID identity, EventSource source,
                                 Object offendingRecord, String message) {
        ConflictRecord conflict = new ConflictRecord(
            category, identity, source, snapshot(offendingRecord), message, clock.instant());
        records.add(conflict);
        log.warn("[{}] {} (identity={}, source={})", category.getDisplayName(), message, identity, source);
        return conflict;
    }

    public void addAll(List<ConflictRecord> conflicts) {
        conflicts.forEach(conflict -> {
            records.add(conflict);
            log.warn("[{}] {} (identity={}, source={})", conflict.category().getDisplayName(),
                conflict.message(), conflict.identity(), conflict.source());
        });
    }

    public List<ConflictRecord> records() {
        return Collections.unmodifiableList(records);
    }

    public List<ConflictRecord> records(ConflictCategory category) {
        return records.stream().filter(r -> r.category() == category).toList();
    }

    public Map<ConflictCategory, Long> countsByCategory() {
        Map<ConflictCategory, Long> counts = new EnumMap<>(ConflictCategory.class);
        records.forEach(r -> counts.merge(r.category(), 1L, Long::sum));
        return counts;
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int size() {
        return records.size();
    }

    private Map<String, Object> snapshot(Object offendingRecord) {
        if (offendingRecord == null) {
            return Map.of();
        }
        try {
            return objectMapper.convertValue(offendingRecord, SNAPSHOT_TYPE);
        } catch (IllegalArgumentException e) {
            log.error("Could not snapshot {} for conflict report", offendingRecord.getClass().getSimpleName(), e);
            return Map.of("record", String.valueOf(offendingRecord));
        }
    }
}
