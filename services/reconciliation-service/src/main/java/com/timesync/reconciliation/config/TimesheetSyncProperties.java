package com.timesync.reconciliation.config;

import com.timesync.reconciliation.domain.WhitelistEntry;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Timesheet synchronization configuration properties
 */
@Data
@Component
@ConfigurationProperties(prefix = "timesync")
public class TimesheetSyncProperties {

    /**
     * Zone every timestamp is normalized to before comparison
     */
    private String referenceZone = "Europe/Amsterdam";

    /**
     * Zone for database timestamps without an offset, defaults to the reference zone
     */
    private String databaseZone;

    /**
     * Zone for external timestamps without an offset, defaults to the reference zone
     */
    private String externalZone;

    /**
     * Classify and report only, never write to the external system
     */
    private boolean dryRun = false;

    /**
     * Run once when the application starts
     */
    private boolean runOnStartup = false;

    /**
     * Directory for JSON run reports
     */
    private String outputDir = "output";

    private DevelopmentConfig development = new DevelopmentConfig();

    private ScheduleConfig schedule = new ScheduleConfig();

    private ReportConfig report = new ReportConfig();

    private DatabaseConfig database = new DatabaseConfig();

    /**
     * External records approved to exist without an event identity
     */
    private List<WhitelistEntry> whitelist = new ArrayList<>();

    @Data
    public static class DevelopmentConfig {
        /**
         * Force every run to {@link #testYear}
         */
        private boolean enabled = false;

        private int testYear = 2024;
    }

    @Data
    public static class ScheduleConfig {
        private boolean enabled = false;

        /**
         * Cron expression for the periodic run of the current year
         */
        private String cron = "0 0 6 * * *";
    }

    @Data
    public static class ReportConfig {
        /**
         * Write a JSON conflict report per run to {@code outputDir}
         */
        private boolean jsonEnabled = true;
    }

    @Data
    public static class DatabaseConfig {
        /**
         * Classpath location of the event query, takes the year as its only parameter
         */
        private String queryLocation = "sql/database-events.sql";
    }
}
