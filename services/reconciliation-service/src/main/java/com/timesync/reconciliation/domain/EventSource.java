package com.timesync.reconciliation.domain;

/**
 * Origin of a canonical event
 */
public enum EventSource {
    DATABASE,
    EXTERNAL
}
