package com.timesync.reconciliation.engine;

import com.timesync.reconciliation.basedata.BaseDataResolver;
import com.timesync.reconciliation.conflict.ConflictLog;
import com.timesync.reconciliation.domain.WhitelistEntry;
import lombok.Getter;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * State that lives for exactly one run. The base data snapshot and the
 * whitelist are frozen at construction; only the identity bookkeeping and the
 * conflict log grow while the passes execute.
 */
@Getter
public class ReconciliationContext {

    private final int year;
    private final boolean dryRun;
    private final BaseDataResolver resolver;
    private final Set<String> whitelistedRecordIds;
    private final ConflictLog conflictLog;

    private final Set<UUID> databaseIdentities = new HashSet<>();
    private final Set<UUID> insertedIdentities = new HashSet<>();

    public ReconciliationContext(int year, boolean dryRun, BaseDataResolver resolver,
                                 Collection<WhitelistEntry> whitelist, ConflictLog conflictLog) {
        this.year = year;
        this.dryRun = dryRun;
        this.resolver = resolver;
        this.whitelistedRecordIds = whitelist == null ? Set.of() : whitelist.stream()
            .map(WhitelistEntry::getExternalRecordId)
            .filter(id -> id != null && !id.isBlank())
            .map(String::strip)
            .collect(Collectors.toUnmodifiableSet());
        this.conflictLog = conflictLog;
    }

    public boolean isWhitelisted(String externalRecordId) {
        return externalRecordId != null && whitelistedRecordIds.contains(externalRecordId.strip());
    }

    /**
     * Identity known on the database side, either read this run or inserted by it.
     */
    public boolean isKnownIdentity(UUID identity) {
        return databaseIdentities.contains(identity) || insertedIdentities.contains(identity);
    }

    void registerDatabaseIdentity(UUID identity) {
        databaseIdentities.add(identity);
    }

    void registerInserted(UUID identity) {
        insertedIdentities.add(identity);
    }
}
