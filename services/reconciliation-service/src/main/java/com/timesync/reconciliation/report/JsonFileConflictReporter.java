package com.timesync.reconciliation.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.timesync.reconciliation.config.TimesheetSyncProperties;
import com.timesync.reconciliation.domain.ConflictRecord;
import com.timesync.reconciliation.exception.TimesheetSyncException;
import com.timesync.reconciliation.service.SyncRunSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persists the summary and conflicts of each run as
 * {@code conflicts_<year>_<yyyyMMdd_HHmmss>.json} in the output directory
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "timesync.report", name = "json-enabled", havingValue = "true", matchIfMissing = true)
public class JsonFileConflictReporter implements ConflictReporter {

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ObjectMapper objectMapper;
    private final TimesheetSyncProperties properties;
    private final Clock clock;

    @Override
    public void reportConflicts(List<ConflictRecord> conflicts, SyncRunSummary summary) {
        Path outputDir = Path.of(properties.getOutputDir());
        Path file = outputDir.resolve(String.format("conflicts_%d_%s.json",
            summary.getYear(), LocalDateTime.now(clock).format(FILE_TIMESTAMP)));

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("summary", summary);
        report.put("conflicts", conflicts);

        try {
            Files.createDirectories(outputDir);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), report);
            log.info("Saved conflict report with {} entries to {}", conflicts.size(), file);
        } catch (IOException e) {
            throw new TimesheetSyncException("REPORT_WRITE_FAILED", "Could not write conflict report to " + file, e, file);
        }
    }
}
