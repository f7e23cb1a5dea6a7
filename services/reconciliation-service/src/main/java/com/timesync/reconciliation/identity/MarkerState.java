package com.timesync.reconciliation.identity;

/**
 * State of the identity marker on the last line of a description
 */
public enum MarkerState {
    /** No marker line at all */
    ABSENT,
    /** A marker line is present but its payload is not a valid identity */
    MALFORMED,
    VALID
}
