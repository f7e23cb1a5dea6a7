package com.timesync.reconciliation.scheduler;

import com.timesync.reconciliation.config.TimesheetSyncProperties;
import com.timesync.reconciliation.exception.SyncPrerequisiteException;
import com.timesync.reconciliation.service.SyncRunSummary;
import com.timesync.reconciliation.service.TimesheetSyncService;
import com.timesync.reconciliation.support.TestEvents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StartupSyncRunnerTest {

    @Mock
    private TimesheetSyncService syncService;

    private final TimesheetSyncProperties properties = new TimesheetSyncProperties();
    private StartupSyncRunner runner;

    @BeforeEach
    void setUp() {
        runner = new StartupSyncRunner(syncService, properties, TestEvents.CLOCK);
    }

    @Test
    void shouldRunRequestedYearInDryRun() {
        when(syncService.synchronize(2023, true)).thenReturn(SyncRunSummary.builder().year(2023).dryRun(true).build());

        runner.run(new DefaultApplicationArguments("--year=2023", "--dry-run"));

        verify(syncService).synchronize(2023, true);
    }

    @Test
    void shouldDefaultToClockYearAndConfiguredMode() {
        properties.setDryRun(true);
        when(syncService.synchronize(2024, true)).thenReturn(SyncRunSummary.builder().year(2024).build());

        runner.run(new DefaultApplicationArguments());

        verify(syncService).synchronize(2024, true);
    }

    @Test
    void shouldRejectNonNumericYear() {
        assertThatThrownBy(() -> runner.resolveYear(new DefaultApplicationArguments("--year=last")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("last");
    }

    @Test
    void shouldPropagatePrerequisiteFailure() {
        when(syncService.synchronize(2024, false))
            .thenThrow(new SyncPrerequisiteException("external events", "Failed to fetch external events", null));

        assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments()))
            .isInstanceOf(SyncPrerequisiteException.class);
    }

    @Test
    void scheduledRunShouldNotPropagateFailures() {
        when(syncService.synchronizeCurrentYear()).thenThrow(new IllegalStateException("boom"));
        TimesheetSyncScheduler scheduler = new TimesheetSyncScheduler(syncService);

        assertThatCode(scheduler::synchronizeCurrentYear).doesNotThrowAnyException();
    }
}
