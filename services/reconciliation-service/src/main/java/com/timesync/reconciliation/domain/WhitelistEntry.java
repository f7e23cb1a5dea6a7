package com.timesync.reconciliation.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Manually approved external-only record that is exempt from out-of-sync reporting
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WhitelistEntry {

    private String externalRecordId;

    private String reason;

    private String approvedBy;
}
