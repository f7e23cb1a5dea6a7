package com.timesync.reconciliation.exception;

import com.timesync.reconciliation.domain.CategoryKind;

/**
 * Thrown when a database category value has no counterpart in the external
 * system's dropdown contents. Resolution failure blocks every write for the record.
 */
public class BaseDataConflictException extends TimesheetSyncException {

    private final CategoryKind kind;
    private final String rawValue;

    public BaseDataConflictException(CategoryKind kind, String rawValue, String message) {
        super("BASE_DATA_CONFLICT", message, kind, rawValue);
        this.kind = kind;
        this.rawValue = rawValue;
    }

    public CategoryKind getKind() {
        return kind;
    }

    public String getRawValue() {
        return rawValue;
    }
}
