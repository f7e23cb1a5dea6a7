package com.timesync.reconciliation.engine;

import com.timesync.reconciliation.domain.CanonicalEvent;
import com.timesync.reconciliation.domain.CategoryKind;
import com.timesync.reconciliation.domain.CategoryRef;
import com.timesync.reconciliation.domain.EventSource;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class EventComparatorTest {

    private final CanonicalEvent base = CanonicalEvent.builder()
        .identity(UUID.randomUUID())
        .source(EventSource.DATABASE)
        .subject("Standup")
        .description("Daily")
        .start(LocalDateTime.of(2024, 2, 1, 9, 0))
        .end(LocalDateTime.of(2024, 2, 1, 9, 15))
        .hours(new BigDecimal("0.25"))
        .employee(CategoryRef.resolved(CategoryKind.EMPLOYEE, "Jan Jansen", "emp-1"))
        .project(CategoryRef.resolved(CategoryKind.PROJECT, "Acme", "prj-1"))
        .activity(CategoryRef.resolved(CategoryKind.ACTIVITY, "Meeting", "act-2"))
        .build();

    @Test
    void shouldIgnoreBookkeepingFieldsAndLabelCasing() {
        CanonicalEvent external = base.toBuilder()
            .source(EventSource.EXTERNAL)
            .externalRecordId("EXT-1")
            .invoiced(true)
            .hours(new BigDecimal("0.250"))
            .project(CategoryRef.resolved(CategoryKind.PROJECT, "ACME", "prj-1"))
            .build();

        assertThat(EventComparator.differences(base, external)).isEmpty();
    }

    @Test
    void shouldNameEveryDifferingField() {
        CanonicalEvent external = base.toBuilder()
            .description("Daily\nextra")
            .hours(new BigDecimal("0.5"))
            .activity(CategoryRef.resolved(CategoryKind.ACTIVITY, "Meeting", "act-3"))
            .build();

        assertThat(EventComparator.differences(base, external)).containsExactly("hours", "description", "activity");
    }
}
