package com.timesync.reconciliation.exception;

/**
 * Thrown by the external gateway when an insert or update did not go through
 */
public class ExternalWriteException extends TimesheetSyncException {

    private final String externalRecordId;

    public ExternalWriteException(String externalRecordId, String message) {
        super("EXTERNAL_WRITE_ERROR", message, externalRecordId);
        this.externalRecordId = externalRecordId;
    }

    public ExternalWriteException(String externalRecordId, String message, Throwable cause) {
        super("EXTERNAL_WRITE_ERROR", message, cause, externalRecordId);
        this.externalRecordId = externalRecordId;
    }

    public String getExternalRecordId() {
        return externalRecordId;
    }
}
