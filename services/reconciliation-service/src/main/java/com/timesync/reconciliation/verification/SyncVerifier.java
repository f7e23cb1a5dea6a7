package com.timesync.reconciliation.verification;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.timesync.reconciliation.conflict.ConflictLog;
import com.timesync.reconciliation.domain.CanonicalEvent;
import com.timesync.reconciliation.domain.ConflictCategory;
import com.timesync.reconciliation.domain.ConflictRecord;
import com.timesync.reconciliation.domain.EventSource;
import com.timesync.reconciliation.domain.RawExternalEvent;
import com.timesync.reconciliation.engine.EventComparator;
import com.timesync.reconciliation.exception.NormalizationException;
import com.timesync.reconciliation.exception.TimesheetSyncException;
import com.timesync.reconciliation.normalizer.EventNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Re-reads the external system after the mutations of a run and checks that
 * every record the run expects to be in place holds the database values.
 * A mismatch here means a write did not take effect, was altered by the
 * external system, or raced with a concurrent edit.
 */
@Slf4j
@RequiredArgsConstructor
public class SyncVerifier {

    private final EventNormalizer normalizer;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * @param expectedEvents resolved database events that should now exist unchanged
     * @param externalFetch  fetches a fresh external snapshot
     * @return one DataDiscrepancy record per event that is missing or differs
     */
    public List<ConflictRecord> verify(List<CanonicalEvent> expectedEvents,
                                       Supplier<List<RawExternalEvent>> externalFetch) {
        if (expectedEvents.isEmpty()) {
            log.info("Nothing to verify");
            return List.of();
        }

        List<RawExternalEvent> fresh;
        try {
            fresh = externalFetch.get();
        } catch (RuntimeException e) {
            throw new TimesheetSyncException("VERIFICATION_FETCH_FAILED",
                "Could not re-fetch external events for verification", e);
        }

        ConflictLog discrepancies = new ConflictLog(objectMapper, clock);
        Map<UUID, List<CanonicalEvent>> actualByIdentity = index(fresh);

        for (CanonicalEvent expected : expectedEvents) {
            UUID identity = expected.getIdentity();
            List<CanonicalEvent> actual = actualByIdentity.getOrDefault(identity, List.of());
            if (actual.isEmpty()) {
                discrepancies.record(ConflictCategory.DATA_DISCREPANCY, identity, EventSource.DATABASE, expected,
                    "Event " + identity + " is missing from the external system after synchronization");
            } else if (actual.size() > 1) {
                discrepancies.record(ConflictCategory.DATA_DISCREPANCY, identity, EventSource.EXTERNAL, actual.get(1),
                    "Event " + identity + " exists " + actual.size() + " times after synchronization");
            } else {
                List<String> diffs = EventComparator.differences(expected, actual.get(0));
                if (!diffs.isEmpty()) {
                    discrepancies.record(ConflictCategory.DATA_DISCREPANCY, identity, EventSource.EXTERNAL, actual.get(0),
                        "Event " + identity + " still differs in " + diffs + " after synchronization");
                }
            }
        }

        log.info("Verified {} events against {} external records, {} discrepancies",
            expectedEvents.size(), fresh.size(), discrepancies.size());
        return discrepancies.records();
    }

    private Map<UUID, List<CanonicalEvent>> index(List<RawExternalEvent> fresh) {
        Map<UUID, List<CanonicalEvent>> byIdentity = new HashMap<>();
        for (RawExternalEvent raw : fresh) {
            try {
                CanonicalEvent event = normalizer.normalize(raw);
                if (event.hasIdentity()) {
                    byIdentity.computeIfAbsent(event.getIdentity(), id -> new ArrayList<>()).add(event);
                }
            } catch (NormalizationException e) {
                log.warn("Skipping unreadable external record {} during verification: {}",
                    raw.getExternalRecordId(), e.getMessage());
            }
        }
        return byIdentity;
    }
}
