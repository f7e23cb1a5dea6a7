package com.timesync.reconciliation.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.timesync.reconciliation.client.DatabaseEventSource;
import com.timesync.reconciliation.client.ExternalEventGateway;
import com.timesync.reconciliation.client.WhitelistProvider;
import com.timesync.reconciliation.config.TimesheetSyncProperties;
import com.timesync.reconciliation.domain.ConflictCategory;
import com.timesync.reconciliation.domain.ConflictRecord;
import com.timesync.reconciliation.engine.SyncAction;
import com.timesync.reconciliation.exception.SyncPrerequisiteException;
import com.timesync.reconciliation.identity.EventIdentityCodec;
import com.timesync.reconciliation.normalizer.EventNormalizer;
import com.timesync.reconciliation.report.ConflictReporter;
import com.timesync.reconciliation.support.InMemoryExternalEventGateway;
import com.timesync.reconciliation.support.TestEvents;
import com.timesync.reconciliation.verification.SyncVerifier;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("TimesheetSyncService Unit Tests")
class TimesheetSyncServiceTest {

    private static final UUID EVENT_ID = UUID.fromString("1b4e28ba-2fa1-11d2-883f-0016d3cca427");

    @Mock
    private DatabaseEventSource databaseEventSource;

    @Mock
    private ObjectProvider<ExternalEventGateway> gatewayProvider;

    @Mock
    private WhitelistProvider whitelistProvider;

    @Mock
    private ConflictReporter firstReporter;

    @Mock
    private ConflictReporter secondReporter;

    private InMemoryExternalEventGateway gateway;
    private TimesheetSyncProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private TimesheetSyncService syncService;

    @BeforeEach
    void setUp() {
        gateway = TestEvents.gatewayWithBaseData();
        properties = new TimesheetSyncProperties();
        meterRegistry = new SimpleMeterRegistry();

        ObjectMapper objectMapper = TestEvents.objectMapper();
        EventIdentityCodec codec = new EventIdentityCodec();
        EventNormalizer normalizer = new EventNormalizer(codec, TestEvents.ZONE);

        syncService = new TimesheetSyncService(databaseEventSource, gatewayProvider, whitelistProvider,
            normalizer, codec, new SyncVerifier(normalizer, objectMapper, TestEvents.CLOCK),
            List.of(firstReporter, secondReporter), properties, objectMapper, meterRegistry, TestEvents.CLOCK);

        lenient().when(gatewayProvider.getIfAvailable()).thenReturn(gateway);
        lenient().when(whitelistProvider.getWhitelist()).thenReturn(List.of());
    }

    @Test
    void shouldSynchronizeAndVerifyYear() {
        when(databaseEventSource.fetchDatabaseEvents(2024)).thenReturn(List.of(TestEvents.dbEvent(EVENT_ID).build()));

        SyncRunSummary summary = syncService.synchronize(2024, false);

        assertThat(summary.getYear()).isEqualTo(2024);
        assertThat(summary.getDatabaseEvents()).isEqualTo(1);
        assertThat(summary.getAppliedMutations()).isEqualTo(1);
        assertThat(summary.getActions()).containsEntry(SyncAction.INSERT, 1L);
        assertThat(summary.isVerificationCompleted()).isTrue();
        assertThat(summary.getVerificationDiscrepancies()).isZero();
        assertThat(gateway.getInserts()).hasSize(1);

        verify(firstReporter).reportConflicts(List.of(), summary);
        assertThat(meterRegistry.counter("timesync.reconciliation.actions", "action", "INSERT").count())
            .isEqualTo(1.0);
        assertThat(meterRegistry.timer("timesync.reconciliation.run", "dry_run", "false").count()).isEqualTo(1);
    }

    @Test
    void shouldNotWriteOrVerifyInDryRun() {
        when(databaseEventSource.fetchDatabaseEvents(2024)).thenReturn(List.of(TestEvents.dbEvent(EVENT_ID).build()));

        SyncRunSummary summary = syncService.synchronize(2024, true);

        assertThat(summary.isDryRun()).isTrue();
        assertThat(summary.getAppliedMutations()).isZero();
        assertThat(summary.isVerificationCompleted()).isFalse();
        assertThat(gateway.writeCount()).isZero();
    }

    @Test
    void shouldPassConflictsToEveryReporterEvenWhenOneFails() {
        gateway.withRecord(TestEvents.externalEvent("EXT-5", null).build());
        when(databaseEventSource.fetchDatabaseEvents(2024)).thenReturn(List.of());
        doThrow(new IllegalStateException("mail server down"))
            .when(firstReporter).reportConflicts(anyList(), any(SyncRunSummary.class));

        SyncRunSummary summary = syncService.synchronize(2024, false);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ConflictRecord>> captor = ArgumentCaptor.forClass(List.class);
        verify(secondReporter).reportConflicts(captor.capture(), eq(summary));
        assertThat(captor.getValue()).extracting(ConflictRecord::category)
            .containsExactly(ConflictCategory.OUT_OF_SYNC);
        assertThat(summary.getConflicts()).containsEntry(ConflictCategory.OUT_OF_SYNC, 1L);
        assertThat(summary.isVerificationCompleted()).isTrue();
    }

    @Test
    void shouldContinueWithEmptyWhitelistWhenUnavailable() {
        gateway.withRecord(TestEvents.externalEvent("EXT-5", null).build());
        when(databaseEventSource.fetchDatabaseEvents(2024)).thenReturn(List.of());
        when(whitelistProvider.getWhitelist()).thenThrow(new IllegalStateException("sheet locked"));

        SyncRunSummary summary = syncService.synchronize(2024, false);

        assertThat(summary.getActions()).containsEntry(SyncAction.OUT_OF_SYNC, 1L);
    }

    @Test
    void shouldAbortWhenDatabaseCannotBeRead() {
        when(databaseEventSource.fetchDatabaseEvents(anyInt())).thenThrow(new IllegalStateException("login failed"));

        assertThatThrownBy(() -> syncService.synchronize(2024, false))
            .isInstanceOf(SyncPrerequisiteException.class)
            .hasFieldOrPropertyWithValue("prerequisite", "database events")
            .hasRootCauseMessage("login failed");

        assertThat(gateway.writeCount()).isZero();
        assertThat(meterRegistry.counter("timesync.reconciliation.failures", "prerequisite", "database events").count())
            .isEqualTo(1.0);
        verify(firstReporter, never()).reportConflicts(anyList(), any());
    }

    @Test
    void shouldAbortWithoutExternalGateway() {
        when(gatewayProvider.getIfAvailable()).thenReturn(null);

        assertThatThrownBy(() -> syncService.synchronize(2024, false))
            .isInstanceOf(SyncPrerequisiteException.class)
            .hasFieldOrPropertyWithValue("prerequisite", "external-gateway");
    }

    @Test
    void shouldForceTestYearInDevelopmentMode() {
        properties.getDevelopment().setEnabled(true);
        properties.getDevelopment().setTestYear(2023);
        when(databaseEventSource.fetchDatabaseEvents(2023)).thenReturn(List.of());

        SyncRunSummary summary = syncService.synchronize(2026, false);

        assertThat(summary.getYear()).isEqualTo(2023);
        verify(databaseEventSource).fetchDatabaseEvents(2023);
    }

    @Test
    void shouldUseClockYearAndConfiguredDryRunForCurrentYear() {
        properties.setDryRun(true);
        when(databaseEventSource.fetchDatabaseEvents(2024)).thenReturn(List.of());

        SyncRunSummary summary = syncService.synchronizeCurrentYear();

        assertThat(summary.getYear()).isEqualTo(2024);
        assertThat(summary.isDryRun()).isTrue();
    }
}
