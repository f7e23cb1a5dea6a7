package com.timesync.reconciliation.exception;

/**
 * Thrown when a raw event cannot be converted into its canonical shape,
 * typically because a required field is absent or a timestamp does not parse.
 */
public class NormalizationException extends TimesheetSyncException {

    private final String field;

    public NormalizationException(String field, String message) {
        super("NORMALIZATION_ERROR", message, field);
        this.field = field;
    }

    public NormalizationException(String field, String message, Throwable cause) {
        super("NORMALIZATION_ERROR", message, cause, field);
        this.field = field;
    }

    protected NormalizationException(String errorCode, String field, String message) {
        super(errorCode, message, field);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
