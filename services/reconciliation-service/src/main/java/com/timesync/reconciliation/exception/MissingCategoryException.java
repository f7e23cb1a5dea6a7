package com.timesync.reconciliation.exception;

import com.timesync.reconciliation.domain.CategoryKind;

/**
 * Thrown when a database event carries no project or activity assignment at all
 */
public class MissingCategoryException extends NormalizationException {

    private final CategoryKind kind;

    public MissingCategoryException(CategoryKind kind, String message) {
        super("MISSING_CATEGORY", kind.name().toLowerCase(), message);
        this.kind = kind;
    }

    public CategoryKind getKind() {
        return kind;
    }
}
