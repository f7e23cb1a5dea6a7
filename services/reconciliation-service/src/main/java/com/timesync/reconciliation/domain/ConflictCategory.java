package com.timesync.reconciliation.domain;

/**
 * Categories of issues surfaced to the conflict report
 */
public enum ConflictCategory {
    MISSING_CATEGORY("MissingCategory"),
    BASE_DATA_CONFLICT("BaseDataConflict"),
    INVOICED_CONFLICT("Conflict"),
    DATA_DISCREPANCY("DataDiscrepancy"),
    ORPHANED_EVENT("OrphanedEvent"),
    OUT_OF_SYNC("OutOfSync"),
    EXTERNAL_WRITE_FAILURE("ExternalWriteFailure");

    private final String displayName;

    ConflictCategory(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
