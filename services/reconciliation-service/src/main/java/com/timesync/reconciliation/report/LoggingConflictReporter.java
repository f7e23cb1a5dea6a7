package com.timesync.reconciliation.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.timesync.reconciliation.domain.ConflictCategory;
import com.timesync.reconciliation.domain.ConflictRecord;
import com.timesync.reconciliation.service.SyncRunSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes the run's conflicts to the application log, grouped per category
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LoggingConflictReporter implements ConflictReporter {

    private final ObjectMapper objectMapper;

    @Override
    public void reportConflicts(List<ConflictRecord> conflicts, SyncRunSummary summary) {
        if (conflicts.isEmpty()) {
            log.info("No conflicts for {}", summary.getYear());
            return;
        }

        Map<ConflictCategory, List<ConflictRecord>> grouped = conflicts.stream()
            .collect(Collectors.groupingBy(ConflictRecord::category,
                () -> new EnumMap<>(ConflictCategory.class), Collectors.toList()));

        log.warn("=== {} conflicts for {} ===", conflicts.size(), summary.getYear());
        grouped.forEach((category, records) -> {
            log.warn("--- {} ({}) ---", category.getDisplayName(), records.size());
            records.forEach(record -> log.warn("{} | {}", record.message(), toJson(record.snapshot())));
        });
    }

    private String toJson(Map<String, Object> snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            log.debug("Snapshot not serializable", e);
            return snapshot.toString();
        }
    }
}
