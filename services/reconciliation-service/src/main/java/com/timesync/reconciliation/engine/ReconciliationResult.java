package com.timesync.reconciliation.engine;

import com.timesync.reconciliation.domain.CanonicalEvent;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcomes of both passes of one run, in processing order
 */
public record ReconciliationResult(
    int year,
    boolean dryRun,
    List<RecordOutcome> outcomes
) {

    public ReconciliationResult {
        outcomes = List.copyOf(outcomes);
    }

    public long count(SyncAction action) {
        return outcomes.stream().filter(o -> o.action() == action).count();
    }

    public Map<SyncAction, Long> countsByAction() {
        Map<SyncAction, Long> counts = new EnumMap<>(SyncAction.class);
        outcomes.forEach(o -> counts.merge(o.action(), 1L, Long::sum));
        return counts;
    }

    /**
     * Mutations that were actually sent to the external system
     */
    public long appliedMutations() {
        return outcomes.stream().filter(o -> o.action().isMutation() && o.applied()).count();
    }

    /**
     * Database state the external system is expected to hold after the run:
     * applied inserts and updates plus records that were already identical.
     */
    public List<CanonicalEvent> expectedState() {
        return outcomes.stream()
            .filter(o -> o.intended() != null)
            .filter(o -> o.action() == SyncAction.NO_CHANGE || (o.action().isMutation() && o.applied()))
            .map(RecordOutcome::intended)
            .toList();
    }
}
