package com.timesync.reconciliation.service;

import com.timesync.reconciliation.domain.ConflictCategory;
import com.timesync.reconciliation.engine.SyncAction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Statistics of one synchronization run
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncRunSummary {

    private int year;

    private boolean dryRun;

    private Instant startedAt;

    private Instant finishedAt;

    private long durationMillis;

    private int databaseEvents;

    private int externalEvents;

    private long appliedMutations;

    private Map<SyncAction, Long> actions;

    private Map<ConflictCategory, Long> conflicts;

    private boolean verificationCompleted;

    private int verificationDiscrepancies;
}
