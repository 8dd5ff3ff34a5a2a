package com.example.securitycore.access;

import com.example.securitycore.models.AuditEntry;
import java.util.List;
import java.util.Optional;

/**
 * Storage abstraction for the append-only {@code audit_entries} table. Entries of one
 * tenant form a chain keyed by sequence number; implementations only ever add an entry
 * to a free slot, so the service can treat {@link #append} as a compare-and-set on the tail.
 */
public interface AuditEntryAccess {

    /**
     * Stores the entry if no entry exists yet for its (tenant, sequence).
     *
     * @throws ChainConflictException if the slot is taken
     */
    void append(AuditEntry entry);

    Optional<AuditEntry> findLatest(String tenantId);

    /**
     * Entries of a tenant with {@code from <= sequence <= to}, ascending.
     */
    List<AuditEntry> findRange(String tenantId, long fromSequence, long toSequence);

    /**
     * Entries of a tenant whose timestamp falls in {@code [startTimestamp, endTimestamp)}, ascending by sequence.
     */
    List<AuditEntry> findByTimeRange(String tenantId, long startTimestamp, long endTimestamp);

    /**
     * Finds all audit entries, across tenants, with timestamp older than the cutoff.
     * Used for retention policy enforcement.
     */
    List<AuditEntry> findEntriesOlderThan(long cutoffTimestamp);

    /**
     * Removes an entry. Only the retention job calls this, after recording the purge in the chain.
     */
    void delete(AuditEntry entry);
}
