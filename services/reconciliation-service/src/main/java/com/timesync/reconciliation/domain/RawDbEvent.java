package com.timesync.reconciliation.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Event row as produced by the authoritative database query.
 * Timestamps are kept as the ISO strings the query renders.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawDbEvent {

    private String eventId;

    private String userName;

    private String userEmail;

    private String subject;

    private String description;

    private String startDate;

    private String endDate;

    /**
     * Registered hours when the source carries them, otherwise derived from start and end
     */
    private BigDecimal hours;

    private String project;

    private String activity;

    private String lastModified;
}
