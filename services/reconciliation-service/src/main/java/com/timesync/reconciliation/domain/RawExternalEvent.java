package com.timesync.reconciliation.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Time registration as read from the external accounting system.
 * Category fields already carry dropdown identifiers.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RawExternalEvent {

    /**
     * Record id assigned by the external system
     */
    private String externalRecordId;

    private String subject;

    /**
     * Free text, last line carries the event identity marker when synchronized
     */
    private String description;

    private String startDate;

    private String endDate;

    private BigDecimal hours;

    private String employeeId;

    private String employeeName;

    private String projectId;

    private String projectName;

    private String activityId;

    private String activityName;

    private boolean invoiced;

    private String lastModified;
}
