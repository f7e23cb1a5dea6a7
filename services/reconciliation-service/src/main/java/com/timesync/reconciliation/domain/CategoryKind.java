package com.timesync.reconciliation.domain;

/**
 * Kinds of base data the external system exposes as dropdowns
 */
public enum CategoryKind {
    EMPLOYEE,
    PROJECT,
    ACTIVITY
}
