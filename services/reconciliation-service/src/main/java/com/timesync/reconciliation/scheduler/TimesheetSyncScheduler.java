package com.timesync.reconciliation.scheduler;

import com.timesync.reconciliation.service.TimesheetSyncService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled synchronization of the current year
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "timesync.schedule", name = "enabled", havingValue = "true")
public class TimesheetSyncScheduler {

    private final TimesheetSyncService syncService;

    @Scheduled(cron = "${timesync.schedule.cron:0 0 6 * * *}")
    public void synchronizeCurrentYear() {
        log.info("=== Scheduled Job: Timesheet Synchronization ===");
        try {
            syncService.synchronizeCurrentYear();
        } catch (Exception e) {
            log.error("Error during scheduled timesheet synchronization", e);
        }
    }
}
