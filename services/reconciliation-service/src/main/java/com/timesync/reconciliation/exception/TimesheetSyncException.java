package com.timesync.reconciliation.exception;

/**
 * Base exception for all timesheet synchronization errors
 */
public class TimesheetSyncException extends RuntimeException {

    private final String errorCode;
    private final Object[] args;

    public TimesheetSyncException(String message) {
        super(message);
        this.errorCode = "TIMESHEET_SYNC_ERROR";
        this.args = null;
    }

    public TimesheetSyncException(String errorCode, String message, Object... args) {
        super(message);
        this.errorCode = errorCode;
        this.args = args;
    }

    public TimesheetSyncException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "TIMESHEET_SYNC_ERROR";
        this.args = null;
    }

    public TimesheetSyncException(String errorCode, String message, Throwable cause, Object... args) {
        super(message, cause);
        this.errorCode = errorCode;
        this.args = args;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Object[] getArgs() {
        return args;
    }
}
