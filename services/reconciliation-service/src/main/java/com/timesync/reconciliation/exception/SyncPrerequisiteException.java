package com.timesync.reconciliation.exception;

/**
 * Fatal to a run: one of the full snapshots (database events, external events,
 * dropdown contents) could not be fetched.
 */
public class SyncPrerequisiteException extends TimesheetSyncException {

    private final String prerequisite;

    public SyncPrerequisiteException(String prerequisite, String message, Throwable cause) {
        super("SYNC_PREREQUISITE_FAILED", message, cause, prerequisite);
        this.prerequisite = prerequisite;
    }

    public String getPrerequisite() {
        return prerequisite;
    }
}
