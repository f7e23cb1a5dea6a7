package com.timesync.reconciliation.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.timesync.reconciliation.basedata.BaseDataResolver;
import com.timesync.reconciliation.client.DatabaseEventSource;
import com.timesync.reconciliation.client.ExternalEventGateway;
import com.timesync.reconciliation.client.WhitelistProvider;
import com.timesync.reconciliation.conflict.ConflictLog;
import com.timesync.reconciliation.config.TimesheetSyncProperties;
import com.timesync.reconciliation.domain.ConflictRecord;
import com.timesync.reconciliation.domain.RawDbEvent;
import com.timesync.reconciliation.domain.RawExternalEvent;
import com.timesync.reconciliation.domain.WhitelistEntry;
import com.timesync.reconciliation.engine.ReconciliationContext;
import com.timesync.reconciliation.engine.ReconciliationEngine;
import com.timesync.reconciliation.engine.ReconciliationResult;
import com.timesync.reconciliation.exception.SyncPrerequisiteException;
import com.timesync.reconciliation.exception.TimesheetSyncException;
import com.timesync.reconciliation.identity.EventIdentityCodec;
import com.timesync.reconciliation.normalizer.EventNormalizer;
import com.timesync.reconciliation.report.ConflictReporter;
import com.timesync.reconciliation.verification.SyncVerifier;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.Year;
import java.util.List;
import java.util.function.Supplier;

/**
 * Timesheet Synchronization Service
 *
 * Runs one complete synchronization of a year:
 * - fetches the database events, the external events and the dropdown snapshot
 * - reconciles the database pass and the external pass
 * - verifies the external state after mutations
 * - hands all conflicts to the configured reporters
 *
 * Only a failure to fetch one of the three snapshots aborts a run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TimesheetSyncService {

    private static final String METRIC_PREFIX = "timesync.reconciliation";

    private final DatabaseEventSource databaseEventSource;
    private final ObjectProvider<ExternalEventGateway> gatewayProvider;
    private final WhitelistProvider whitelistProvider;
    private final EventNormalizer normalizer;
    private final EventIdentityCodec identityCodec;
    private final SyncVerifier verifier;
    private final List<ConflictReporter> reporters;
    private final TimesheetSyncProperties properties;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public SyncRunSummary synchronizeCurrentYear() {
        return synchronize(Year.now(clock).getValue(), properties.isDryRun());
    }

    /**
     * @throws SyncPrerequisiteException when a snapshot needed for classification cannot be fetched
     */
    public SyncRunSummary synchronize(int requestedYear, boolean dryRun) {
        int year = effectiveYear(requestedYear);
        Instant startedAt = clock.instant();
        Timer.Sample sample = Timer.start(meterRegistry);
        log.info("Starting timesheet synchronization for {}{}", year, dryRun ? " (DRY-RUN)" : "");

        try {
            ExternalEventGateway gateway = gatewayProvider.getIfAvailable();
            if (gateway == null) {
                throw new SyncPrerequisiteException("external-gateway",
                    "No external event gateway is configured", null);
            }

            List<RawDbEvent> databaseEvents = fetch("database events",
                () -> databaseEventSource.fetchDatabaseEvents(year));
            List<RawExternalEvent> externalEvents = fetch("external events",
                () -> gateway.fetchExternalEvents(year));
            BaseDataResolver resolver = fetch("dropdown snapshot",
                () -> BaseDataResolver.snapshot(gateway::fetchDropdownValues));

            ConflictLog conflictLog = new ConflictLog(objectMapper, clock);
            ReconciliationContext context = new ReconciliationContext(
                year, dryRun, resolver, loadWhitelist(), conflictLog);

            ReconciliationEngine engine = new ReconciliationEngine(normalizer, identityCodec, gateway);
            ReconciliationResult result = engine.reconcile(databaseEvents, externalEvents, context);

            boolean verified = false;
            int discrepancies = 0;
            if (dryRun) {
                log.info("DRY-RUN complete, no changes were made to the external system");
            } else if (result.appliedMutations() == 0) {
                log.info("No mutations applied, external snapshot already verified by classification");
                verified = true;
            } else {
                try {
                    List<ConflictRecord> found = verifier.verify(result.expectedState(),
                        () -> gateway.fetchExternalEvents(year));
                    conflictLog.addAll(found);
                    discrepancies = found.size();
                    verified = true;
                } catch (TimesheetSyncException e) {
                    log.error("Verification for {} could not be completed", year, e);
                }
            }

            Instant finishedAt = clock.instant();
            SyncRunSummary summary = SyncRunSummary.builder()
                .year(year)
                .dryRun(dryRun)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .durationMillis(Duration.between(startedAt, finishedAt).toMillis())
                .databaseEvents(databaseEvents.size())
                .externalEvents(externalEvents.size())
                .appliedMutations(result.appliedMutations())
                .actions(result.countsByAction())
                .conflicts(conflictLog.countsByCategory())
                .verificationCompleted(verified)
                .verificationDiscrepancies(discrepancies)
                .build();

            recordMetrics(summary);
            log.info("Synchronization for {} complete. Stats: {}", year, toJson(summary));
            report(conflictLog.records(), summary);
            return summary;

        } catch (SyncPrerequisiteException e) {
            meterRegistry.counter(METRIC_PREFIX + ".failures", "prerequisite", e.getPrerequisite()).increment();
            log.error("Synchronization for {} aborted: {}", year, e.getMessage(), e);
            throw e;
        } finally {
            sample.stop(meterRegistry.timer(METRIC_PREFIX + ".run", "dry_run", String.valueOf(dryRun)));
        }
    }

    /**
     * Development mode pins every run to the configured test year.
     */
    public int effectiveYear(int requestedYear) {
        TimesheetSyncProperties.DevelopmentConfig development = properties.getDevelopment();
        if (development.isEnabled() && development.getTestYear() != requestedYear) {
            log.info("Development mode enabled, forcing year {} instead of {}", development.getTestYear(), requestedYear);
            return development.getTestYear();
        }
        return requestedYear;
    }

    private <T> T fetch(String prerequisite, Supplier<T> fetcher) {
        try {
            return fetcher.get();
        } catch (RuntimeException e) {
            throw new SyncPrerequisiteException(prerequisite, "Failed to fetch " + prerequisite, e);
        }
    }

    private List<WhitelistEntry> loadWhitelist() {
        try {
            List<WhitelistEntry> whitelist = whitelistProvider.getWhitelist();
            log.info("Loaded {} whitelist entries", whitelist.size());
            return whitelist;
        } catch (RuntimeException e) {
            log.error("Whitelist unavailable, every unidentified external record will be reported", e);
            return List.of();
        }
    }

    private void recordMetrics(SyncRunSummary summary) {
        summary.getActions().forEach((action, count) ->
            meterRegistry.counter(METRIC_PREFIX + ".actions", "action", action.name()).increment(count));
        summary.getConflicts().forEach((category, count) ->
            meterRegistry.counter(METRIC_PREFIX + ".conflicts", "category", category.getDisplayName()).increment(count));
    }

    private void report(List<ConflictRecord> conflicts, SyncRunSummary summary) {
        for (ConflictReporter reporter : reporters) {
            try {
                reporter.reportConflicts(conflicts, summary);
            } catch (RuntimeException e) {
                log.error("Conflict reporter {} failed", reporter.getClass().getSimpleName(), e);
            }
        }
    }

    private String toJson(SyncRunSummary summary) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(summary);
        } catch (JsonProcessingException e) {
            log.debug("Summary not serializable", e);
            return summary.toString();
        }
    }
}
