package com.timesync.reconciliation.support;

import com.timesync.reconciliation.client.ExternalEventGateway;
import com.timesync.reconciliation.domain.CanonicalEvent;
import com.timesync.reconciliation.domain.CategoryKind;
import com.timesync.reconciliation.domain.RawExternalEvent;
import com.timesync.reconciliation.exception.ExternalWriteException;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * External system fake that stores registrations in memory and records every write
 */
public class InMemoryExternalEventGateway implements ExternalEventGateway {

    private final Map<String, RawExternalEvent> records = new LinkedHashMap<>();
    private final Map<CategoryKind, Map<String, String>> dropdowns = new EnumMap<>(CategoryKind.class);
    private final List<CanonicalEvent> inserts = new ArrayList<>();
    private final List<String> updatedRecordIds = new ArrayList<>();
    private final Set<String> failingSubjects = new HashSet<>();
    private int sequence = 1000;

    public InMemoryExternalEventGateway withDropdown(CategoryKind kind, String label, String externalId) {
        dropdowns.computeIfAbsent(kind, k -> new LinkedHashMap<>()).put(label, externalId);
        return this;
    }

    public InMemoryExternalEventGateway withRecord(RawExternalEvent record) {
        records.put(record.getExternalRecordId(), record);
        return this;
    }

    /**
     * Writes of events with this subject fail
     */
    public InMemoryExternalEventGateway failingFor(String subject) {
        failingSubjects.add(subject);
        return this;
    }

    @Override
    public List<RawExternalEvent> fetchExternalEvents(int year) {
        return records.values().stream()
            .map(record -> record.toBuilder().build())
            .toList();
    }

    @Override
    public String insertExternalEvent(CanonicalEvent event) {
        if (failingSubjects.contains(event.getSubject())) {
            throw new ExternalWriteException(null, "Save timed out");
        }
        String id = "EXT-" + (++sequence);
        records.put(id, toRecord(id, event));
        inserts.add(event);
        return id;
    }

    @Override
    public void updateExternalEvent(String externalRecordId, CanonicalEvent event) {
        RawExternalEvent existing = records.get(externalRecordId);
        if (existing == null) {
            throw new ExternalWriteException(externalRecordId, "Record not found");
        }
        if (existing.isInvoiced()) {
            throw new ExternalWriteException(externalRecordId, "Record is invoiced");
        }
        if (failingSubjects.contains(event.getSubject())) {
            throw new ExternalWriteException(externalRecordId, "Save timed out");
        }
        records.put(externalRecordId, toRecord(externalRecordId, event));
        updatedRecordIds.add(externalRecordId);
    }

    @Override
    public Map<String, String> fetchDropdownValues(CategoryKind kind) {
        return Map.copyOf(dropdowns.getOrDefault(kind, Map.of()));
    }

    public List<CanonicalEvent> getInserts() {
        return inserts;
    }

    public List<String> getUpdatedRecordIds() {
        return updatedRecordIds;
    }

    public int writeCount() {
        return inserts.size() + updatedRecordIds.size();
    }

    public RawExternalEvent getRecord(String externalRecordId) {
        return records.get(externalRecordId);
    }

    private static RawExternalEvent toRecord(String id, CanonicalEvent event) {
        return RawExternalEvent.builder()
            .externalRecordId(id)
            .subject(event.getSubject())
            .description(event.getDescription())
            .startDate(event.getStart().toString())
            .endDate(event.getEnd().toString())
            .hours(event.getHours())
            .employeeId(event.getEmployee().externalId())
            .employeeName(event.getEmployee().label())
            .projectId(event.getProject().externalId())
            .projectName(event.getProject().label())
            .activityId(event.getActivity().externalId())
            .activityName(event.getActivity().label())
            .invoiced(false)
            .build();
    }
}
