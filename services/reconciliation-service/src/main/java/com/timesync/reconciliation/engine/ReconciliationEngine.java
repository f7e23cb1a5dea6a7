package com.timesync.reconciliation.engine;

import com.timesync.reconciliation.client.ExternalEventGateway;
import com.timesync.reconciliation.conflict.ConflictLog;
import com.timesync.reconciliation.domain.CanonicalEvent;
import com.timesync.reconciliation.domain.ConflictCategory;
import com.timesync.reconciliation.domain.EventSource;
import com.timesync.reconciliation.domain.RawDbEvent;
import com.timesync.reconciliation.domain.RawExternalEvent;
import com.timesync.reconciliation.exception.BaseDataConflictException;
import com.timesync.reconciliation.exception.ExternalWriteException;
import com.timesync.reconciliation.exception.MissingCategoryException;
import com.timesync.reconciliation.exception.NormalizationException;
import com.timesync.reconciliation.identity.EventIdentityCodec;
import com.timesync.reconciliation.normalizer.EventNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Two-pass reconciliation of database events against external time registrations.
 *
 * <p>The database pass walks every database event and decides, in order:
 * missing category, invoiced counterpart (always a conflict), identical
 * counterpart, differing counterpart, unresolvable base data, clean insert. The external pass then
 * walks every external record and reports orphans (identity without database
 * record) and out-of-sync records (no identity, not whitelisted).
 *
 * <p>The database is leading on content, but an invoiced external record is
 * never written. Nothing is ever deleted. A failure on one record is logged
 * and the run moves on to the next record.
 */
@Slf4j
@RequiredArgsConstructor
public class ReconciliationEngine {

    private final EventNormalizer normalizer;
    private final EventIdentityCodec identityCodec;
    private final ExternalEventGateway gateway;

    public ReconciliationResult reconcile(List<RawDbEvent> databaseEvents,
                                          List<RawExternalEvent> externalEvents,
                                          ReconciliationContext context) {
        log.info("Reconciling {} database events against {} external events for {}{}",
            databaseEvents.size(), externalEvents.size(), context.getYear(),
            context.isDryRun() ? " (DRY-RUN)" : "");

        List<ExternalEntry> externalEntries = indexExternal(externalEvents, context.getConflictLog());
        Map<UUID, List<ExternalEntry>> byIdentity = new LinkedHashMap<>();
        externalEntries.stream()
            .filter(entry -> entry.identity() != null)
            .forEach(entry -> byIdentity.computeIfAbsent(entry.identity(), id -> new ArrayList<>()).add(entry));

        List<RecordOutcome> outcomes = new ArrayList<>();

        // database pass first: inserts made here must count as known identities in the external pass
        for (RawDbEvent raw : databaseEvents) {
            outcomes.add(reconcileDatabaseEvent(raw, byIdentity, context));
        }
        for (ExternalEntry entry : externalEntries) {
            outcomes.add(classifyExternal(entry, context));
        }

        ReconciliationResult result = new ReconciliationResult(context.getYear(), context.isDryRun(), outcomes);
        log.info("Reconciliation for {} finished: {}", context.getYear(), result.countsByAction());
        return result;
    }

    private RecordOutcome reconcileDatabaseEvent(RawDbEvent raw,
                                                 Map<UUID, List<ExternalEntry>> byIdentity,
                                                 ReconciliationContext context) {
        ConflictLog conflicts = context.getConflictLog();
        UUID rawIdentity = parseIdentity(raw.getEventId());
        if (rawIdentity != null && context.getDatabaseIdentities().contains(rawIdentity)) {
            conflicts.record(ConflictCategory.DATA_DISCREPANCY, rawIdentity, EventSource.DATABASE, raw,
                "Database returned event " + rawIdentity + " more than once");
            return RecordOutcome.database(SyncAction.SKIP_INVALID, rawIdentity, "duplicate database identity");
        }
        if (rawIdentity != null) {
            context.registerDatabaseIdentity(rawIdentity);
        }

        try {
            CanonicalEvent event;
            try {
                event = normalizer.normalize(raw);
            } catch (MissingCategoryException e) {
                conflicts.record(ConflictCategory.MISSING_CATEGORY, rawIdentity, EventSource.DATABASE, raw, e.getMessage());
                return RecordOutcome.database(SyncAction.SKIP_MISSING_CATEGORY, rawIdentity, e.getMessage());
            } catch (NormalizationException e) {
                conflicts.record(ConflictCategory.DATA_DISCREPANCY, rawIdentity, EventSource.DATABASE, raw, e.getMessage());
                return RecordOutcome.database(SyncAction.SKIP_INVALID, rawIdentity, e.getMessage());
            }

            UUID identity = event.getIdentity();
            List<ExternalEntry> counterparts = byIdentity.getOrDefault(identity, List.of());
            if (counterparts.size() > 1) {
                return duplicateCounterparts(identity, counterparts, conflicts);
            }
            return counterparts.isEmpty()
                ? insert(event, raw, context)
                : reconcileMatched(event, raw, counterparts.get(0), context);
        } catch (RuntimeException e) {
            log.error("Unexpected failure reconciling database event {}", raw.getEventId(), e);
            conflicts.record(ConflictCategory.DATA_DISCREPANCY, rawIdentity, EventSource.DATABASE, raw,
                "Unexpected failure: " + e.getMessage());
            return RecordOutcome.database(SyncAction.SKIP_INVALID, rawIdentity, e.getMessage());
        }
    }

    private RecordOutcome reconcileMatched(CanonicalEvent event, RawDbEvent raw, ExternalEntry counterpart,
                                           ReconciliationContext context) {
        ConflictLog conflicts = context.getConflictLog();
        UUID identity = event.getIdentity();
        RawExternalEvent external = counterpart.raw();

        if (counterpart.canonical() == null) {
            conflicts.record(ConflictCategory.DATA_DISCREPANCY, identity, EventSource.EXTERNAL, external,
                "External counterpart of " + identity + " is unreadable, not touching it");
            return RecordOutcome.database(SyncAction.SKIP_INVALID, identity, "unreadable external counterpart");
        }

        CanonicalEvent resolved;
        try {
            resolved = normalizer.resolveCategories(event, context.getResolver(), raw.getUserEmail());
        } catch (BaseDataConflictException e) {
            if (external.isInvoiced()) {
                return invoicedConflict(identity, external, List.of(e.getKind().name().toLowerCase()), conflicts);
            }
            conflicts.record(ConflictCategory.BASE_DATA_CONFLICT, identity, EventSource.DATABASE, raw, e.getMessage());
            return RecordOutcome.database(SyncAction.SKIP_BASE_DATA_CONFLICT, identity, e.getMessage());
        }

        List<String> diffs = EventComparator.differences(resolved, counterpart.canonical());
        if (external.isInvoiced()) {
            return invoicedConflict(identity, external, diffs, conflicts);
        }
        if (diffs.isEmpty()) {
            log.debug("Event {} is up to date", identity);
            return new RecordOutcome(SyncAction.NO_CHANGE, identity, external.getExternalRecordId(),
                EventSource.DATABASE, resolved, false, "identical");
        }
        return update(resolved, external.getExternalRecordId(), diffs, context);
    }

    private RecordOutcome invoicedConflict(UUID identity, RawExternalEvent external, List<String> diffs,
                                           ConflictLog conflicts) {
        String detail = diffs.isEmpty() ? "invoiced, identical" : "invoiced, differs in " + diffs;
        conflicts.record(ConflictCategory.INVOICED_CONFLICT, identity, EventSource.EXTERNAL, external,
            "Event " + identity + " is already invoiced and cannot be synchronized (" + detail + ")");
        return new RecordOutcome(SyncAction.SKIP_INVOICED, identity, external.getExternalRecordId(),
            EventSource.DATABASE, null, false, detail);
    }

    private RecordOutcome duplicateCounterparts(UUID identity, List<ExternalEntry> counterparts, ConflictLog conflicts) {
        boolean invoiced = counterparts.stream().anyMatch(entry -> entry.raw().isInvoiced());
        for (ExternalEntry entry : counterparts) {
            conflicts.record(ConflictCategory.DATA_DISCREPANCY, identity, EventSource.EXTERNAL, entry.raw(),
                "Event " + identity + " exists " + counterparts.size() + " times in the external system");
        }
        return RecordOutcome.database(invoiced ? SyncAction.SKIP_INVOICED : SyncAction.SKIP_INVALID, identity,
            "identity not unique in external system");
    }

    private RecordOutcome insert(CanonicalEvent event, RawDbEvent raw, ReconciliationContext context) {
        UUID identity = event.getIdentity();
        CanonicalEvent resolved;
        try {
            resolved = normalizer.resolveCategories(event, context.getResolver(), raw.getUserEmail());
        } catch (BaseDataConflictException e) {
            context.getConflictLog().record(ConflictCategory.BASE_DATA_CONFLICT, identity, EventSource.DATABASE,
                raw, e.getMessage());
            return RecordOutcome.database(SyncAction.SKIP_BASE_DATA_CONFLICT, identity, e.getMessage());
        }

        CanonicalEvent toWrite = withMarker(resolved);
        if (context.isDryRun()) {
            log.info("DRY-RUN would insert event {} ({} h on {})", identity, toWrite.getHours(), toWrite.getStart());
            return new RecordOutcome(SyncAction.INSERT, identity, null, EventSource.DATABASE, resolved, false, "dry-run");
        }
        try {
            String externalRecordId = gateway.insertExternalEvent(toWrite);
            context.registerInserted(identity);
            log.info("Inserted event {} as external record {}", identity, externalRecordId);
            return new RecordOutcome(SyncAction.INSERT, identity, externalRecordId, EventSource.DATABASE,
                resolved, true, "inserted");
        } catch (ExternalWriteException e) {
            return writeFailed(identity, raw, "Insert of event " + identity + " failed: " + e.getMessage(), e, context);
        }
    }

    private RecordOutcome update(CanonicalEvent resolved, String externalRecordId, List<String> diffs,
                                 ReconciliationContext context) {
        UUID identity = resolved.getIdentity();
        CanonicalEvent toWrite = withMarker(resolved).toBuilder().externalRecordId(externalRecordId).build();
        if (context.isDryRun()) {
            log.info("DRY-RUN would update event {} (external record {}), changed: {}", identity, externalRecordId, diffs);
            return new RecordOutcome(SyncAction.UPDATE, identity, externalRecordId, EventSource.DATABASE,
                resolved, false, "dry-run, differs in " + diffs);
        }
        try {
            gateway.updateExternalEvent(externalRecordId, toWrite);
            log.info("Updated event {} (external record {}), changed: {}", identity, externalRecordId, diffs);
            return new RecordOutcome(SyncAction.UPDATE, identity, externalRecordId, EventSource.DATABASE,
                resolved, true, "differs in " + diffs);
        } catch (ExternalWriteException e) {
            return writeFailed(identity, toWrite, "Update of event " + identity + " (external record "
                + externalRecordId + ") failed: " + e.getMessage(), e, context);
        }
    }

    private RecordOutcome writeFailed(UUID identity, Object snapshot, String message, ExternalWriteException cause,
                                      ReconciliationContext context) {
        log.error(message, cause);
        context.getConflictLog().record(ConflictCategory.EXTERNAL_WRITE_FAILURE, identity, EventSource.DATABASE,
            snapshot, message);
        return new RecordOutcome(SyncAction.WRITE_FAILED, identity, cause.getExternalRecordId(),
            EventSource.DATABASE, null, false, cause.getMessage());
    }

    private RecordOutcome classifyExternal(ExternalEntry entry, ReconciliationContext context) {
        RawExternalEvent raw = entry.raw();
        UUID identity = entry.identity();
        if (identity != null) {
            if (context.isKnownIdentity(identity)) {
                return RecordOutcome.external(SyncAction.MATCHED, identity, raw.getExternalRecordId(), "matched");
            }
            context.getConflictLog().record(ConflictCategory.ORPHANED_EVENT, identity, EventSource.EXTERNAL, raw,
                "External record " + raw.getExternalRecordId() + " carries event " + identity
                    + " which does not exist in the database");
            return RecordOutcome.external(SyncAction.ORPHANED, identity, raw.getExternalRecordId(), "no database record");
        }
        if (context.isWhitelisted(raw.getExternalRecordId())) {
            log.debug("External record {} is whitelisted", raw.getExternalRecordId());
            return RecordOutcome.external(SyncAction.WHITELISTED, null, raw.getExternalRecordId(), "whitelisted");
        }
        context.getConflictLog().record(ConflictCategory.OUT_OF_SYNC, null, EventSource.EXTERNAL, raw,
            "External record " + raw.getExternalRecordId() + " has no event identity and is not whitelisted ("
                + identityCodec.inspect(raw.getDescription()).name().toLowerCase() + " marker)");
        return RecordOutcome.external(SyncAction.OUT_OF_SYNC, null, raw.getExternalRecordId(), "unidentified");
    }

    /**
     * Normalizes every external record once. Unreadable records stay in the
     * index with the identity read straight from their description, so their
     * database counterpart is never inserted a second time.
     */
    private List<ExternalEntry> indexExternal(List<RawExternalEvent> externalEvents, ConflictLog conflicts) {
        List<ExternalEntry> entries = new ArrayList<>(externalEvents.size());
        for (RawExternalEvent raw : externalEvents) {
            try {
                CanonicalEvent canonical = normalizer.normalize(raw);
                entries.add(new ExternalEntry(raw, canonical, canonical.getIdentity()));
            } catch (NormalizationException e) {
                UUID identity = identityCodec.extract(raw.getDescription()).orElse(null);
                conflicts.record(ConflictCategory.DATA_DISCREPANCY, identity, EventSource.EXTERNAL, raw,
                    "External record " + raw.getExternalRecordId() + " cannot be read: " + e.getMessage());
                entries.add(new ExternalEntry(raw, null, identity));
            }
        }
        return entries;
    }

    private CanonicalEvent withMarker(CanonicalEvent event) {
        return event.toBuilder()
            .description(identityCodec.embed(event.getDescription(), event.getIdentity()))
            .build();
    }

    private static UUID parseIdentity(String eventId) {
        if (eventId == null || eventId.isBlank()) {
            return null;
        }
        try {
            return UUID.fromString(eventId.strip());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private record ExternalEntry(RawExternalEvent raw, CanonicalEvent canonical, UUID identity) {
    }
}
