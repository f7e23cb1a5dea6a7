package com.timesync.reconciliation.engine;

/**
 * Classification of a single record within a run
 */
public enum SyncAction {
    /** Database record created in the external system */
    INSERT(true),
    /** External counterpart overwritten with database values */
    UPDATE(true),
    NO_CHANGE(false),
    SKIP_MISSING_CATEGORY(false),
    SKIP_BASE_DATA_CONFLICT(false),
    SKIP_INVOICED(false),
    /** Record could not be normalized or its identity is not unique */
    SKIP_INVALID(false),
    WRITE_FAILED(false),
    /** External record whose identity has a database counterpart */
    MATCHED(false),
    ORPHANED(false),
    OUT_OF_SYNC(false),
    WHITELISTED(false);

    private final boolean mutation;

    SyncAction(boolean mutation) {
        this.mutation = mutation;
    }

    public boolean isMutation() {
        return mutation;
    }
}
