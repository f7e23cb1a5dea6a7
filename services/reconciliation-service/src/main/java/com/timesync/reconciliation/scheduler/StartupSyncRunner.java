package com.timesync.reconciliation.scheduler;

import com.timesync.reconciliation.config.TimesheetSyncProperties;
import com.timesync.reconciliation.service.SyncRunSummary;
import com.timesync.reconciliation.service.TimesheetSyncService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Year;
import java.util.List;

/**
 * One-off run at startup. Accepts {@code --year=YYYY} and {@code --dry-run}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "timesync", name = "run-on-startup", havingValue = "true")
public class StartupSyncRunner implements ApplicationRunner {

    static final String YEAR_OPTION = "year";
    static final String DRY_RUN_OPTION = "dry-run";

    private final TimesheetSyncService syncService;
    private final TimesheetSyncProperties properties;
    private final Clock clock;

    @Override
    public void run(ApplicationArguments args) {
        int year = resolveYear(args);
        boolean dryRun = properties.isDryRun() || args.containsOption(DRY_RUN_OPTION);
        SyncRunSummary summary = syncService.synchronize(year, dryRun);
        log.info("Startup synchronization for {} finished in {} ms with {} mutations",
            summary.getYear(), summary.getDurationMillis(), summary.getAppliedMutations());
    }

    int resolveYear(ApplicationArguments args) {
        List<String> values = args.getOptionValues(YEAR_OPTION);
        if (values == null || values.isEmpty()) {
            return Year.now(clock).getValue();
        }
        try {
            return Integer.parseInt(values.get(0).strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--year must be a number, got '" + values.get(0) + "'", e);
        }
    }
}
