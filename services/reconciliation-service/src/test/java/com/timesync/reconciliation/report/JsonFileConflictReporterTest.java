package com.timesync.reconciliation.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.timesync.reconciliation.config.TimesheetSyncProperties;
import com.timesync.reconciliation.domain.ConflictCategory;
import com.timesync.reconciliation.domain.ConflictRecord;
import com.timesync.reconciliation.domain.EventSource;
import com.timesync.reconciliation.engine.SyncAction;
import com.timesync.reconciliation.exception.TimesheetSyncException;
import com.timesync.reconciliation.service.SyncRunSummary;
import com.timesync.reconciliation.support.TestEvents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileConflictReporterTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = TestEvents.objectMapper();
    private final TimesheetSyncProperties properties = new TimesheetSyncProperties();
    private JsonFileConflictReporter reporter;
    private SyncRunSummary summary;

    @BeforeEach
    void setUp() {
        reporter = new JsonFileConflictReporter(objectMapper, properties, TestEvents.CLOCK);
        summary = SyncRunSummary.builder()
            .year(2024)
            .startedAt(Instant.parse("2024-06-01T10:00:00Z"))
            .actions(Map.of(SyncAction.OUT_OF_SYNC, 1L))
            .conflicts(Map.of(ConflictCategory.OUT_OF_SYNC, 1L))
            .build();
    }

    @Test
    void shouldWriteTimestampedReport() throws Exception {
        properties.setOutputDir(tempDir.resolve("reports").toString());
        UUID identity = UUID.randomUUID();
        ConflictRecord conflict = new ConflictRecord(ConflictCategory.ORPHANED_EVENT, identity, EventSource.EXTERNAL,
            Map.of("externalRecordId", "EXT-3"), "no database record", Instant.parse("2024-06-01T10:00:00Z"));

        reporter.reportConflicts(List.of(conflict), summary);

        Path file = tempDir.resolve("reports").resolve("conflicts_2024_20240601_120000.json");
        assertThat(file).exists();

        JsonNode report = objectMapper.readTree(Files.readString(file));
        assertThat(report.path("summary").path("year").asInt()).isEqualTo(2024);
        assertThat(report.path("summary").path("actions").path("OUT_OF_SYNC").asLong()).isEqualTo(1L);
        assertThat(report.path("conflicts")).hasSize(1);
        assertThat(report.path("conflicts").get(0).path("category").asText()).isEqualTo("ORPHANED_EVENT");
        assertThat(report.path("conflicts").get(0).path("identity").asText()).isEqualTo(identity.toString());
        assertThat(report.path("conflicts").get(0).path("snapshot").path("externalRecordId").asText()).isEqualTo("EXT-3");
    }

    @Test
    void shouldFailWhenOutputDirectoryCannotBeCreated() throws Exception {
        Path blocker = Files.writeString(tempDir.resolve("not-a-dir"), "x");
        properties.setOutputDir(blocker.toString());

        assertThatThrownBy(() -> reporter.reportConflicts(List.of(), summary))
            .isInstanceOf(TimesheetSyncException.class)
            .hasFieldOrPropertyWithValue("errorCode", "REPORT_WRITE_FAILED");
    }
}
