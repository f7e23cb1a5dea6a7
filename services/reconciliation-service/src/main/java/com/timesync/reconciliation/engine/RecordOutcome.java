package com.timesync.reconciliation.engine;

import com.timesync.reconciliation.domain.CanonicalEvent;
import com.timesync.reconciliation.domain.EventSource;

import java.util.UUID;

/**
 * What happened to one record in a run.
 *
 * @param action           classification
 * @param identity         event identity, null for unidentified external records
 * @param externalRecordId external record id when one exists or was created
 * @param source           pass that produced the outcome
 * @param intended         resolved database state the external system should hold afterwards, if any
 * @param applied          whether a mutation was actually sent (false in dry-run)
 * @param detail           short explanation for logs and reports
 */
public record RecordOutcome(
    SyncAction action,
    UUID identity,
    String externalRecordId,
    EventSource source,
    CanonicalEvent intended,
    boolean applied,
    String detail
) {

    static RecordOutcome database(SyncAction action, UUID identity, String detail) {
        return new RecordOutcome(action, identity, null, EventSource.DATABASE, null, false, detail);
    }

    static RecordOutcome external(SyncAction action, UUID identity, String externalRecordId, String detail) {
        return new RecordOutcome(action, identity, externalRecordId, EventSource.EXTERNAL, null, false, detail);
    }
}
