package com.timesync.reconciliation.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Source independent, comparable shape of a time registration.
 *
 * <p>Start and end are wall-clock times in the reference zone, truncated to
 * minutes. Hours are quarter-hour rounded. {@code identity} is absent for
 * external records without a well-formed marker line.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CanonicalEvent {

    private UUID identity;

    private EventSource source;

    /**
     * External record id, only set for events read from the external system
     */
    private String externalRecordId;

    private String subject;

    private String description;

    private LocalDateTime start;

    private LocalDateTime end;

    private BigDecimal hours;

    private CategoryRef employee;

    private CategoryRef project;

    private CategoryRef activity;

    private boolean invoiced;

    /**
     * Diagnostics only, never used to decide which side wins
     */
    private Instant lastModified;

    public boolean hasIdentity() {
        return identity != null;
    }
}
