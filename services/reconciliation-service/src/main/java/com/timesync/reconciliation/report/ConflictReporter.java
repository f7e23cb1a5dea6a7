package com.timesync.reconciliation.report;

import com.timesync.reconciliation.domain.ConflictRecord;
import com.timesync.reconciliation.service.SyncRunSummary;

import java.util.List;

/**
 * Sink for the conflicts of a finished run. Notification channels live downstream of this.
 */
public interface ConflictReporter {

    void reportConflicts(List<ConflictRecord> conflicts, SyncRunSummary summary);
}
