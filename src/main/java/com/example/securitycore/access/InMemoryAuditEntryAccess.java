package com.example.securitycore.access;

import com.example.securitycore.models.AuditEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Collectors;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Process-local ledger used with {@code storage.backend=memory}. Each tenant chain is a
 * skip list keyed by sequence; {@code putIfAbsent} gives the same slot semantics as the
 * conditional put in DynamoDB.
 */
@Component
@ConditionalOnProperty(name = "storage.backend", havingValue = "memory")
public class InMemoryAuditEntryAccess implements AuditEntryAccess {

    private final Map<String, ConcurrentNavigableMap<Long, AuditEntry>> chains = new ConcurrentHashMap<>();

    @Override
    public void append(AuditEntry entry) {
        AuditEntry existing = chain(entry.getTenantId()).putIfAbsent(entry.getSequence(), copy(entry));
        if (existing != null) {
            throw new ChainConflictException(entry.getTenantId(), entry.getSequence(), null);
        }
    }

    @Override
    public Optional<AuditEntry> findLatest(String tenantId) {
        Map.Entry<Long, AuditEntry> last = chain(tenantId).lastEntry();
        return last == null ? Optional.empty() : Optional.of(copy(last.getValue()));
    }

    @Override
    public List<AuditEntry> findRange(String tenantId, long fromSequence, long toSequence) {
        if (fromSequence > toSequence) {
            return List.of();
        }
        return chain(tenantId).subMap(fromSequence, true, toSequence, true).values().stream()
                .map(InMemoryAuditEntryAccess::copy)
                .collect(Collectors.toList());
    }

    @Override
    public List<AuditEntry> findByTimeRange(String tenantId, long startTimestamp, long endTimestamp) {
        return chain(tenantId).values().stream()
                .filter(e -> e.getTimestamp() >= startTimestamp && e.getTimestamp() < endTimestamp)
                .map(InMemoryAuditEntryAccess::copy)
                .collect(Collectors.toList());
    }

    @Override
    public List<AuditEntry> findEntriesOlderThan(long cutoffTimestamp) {
        List<AuditEntry> result = new ArrayList<>();
        for (ConcurrentNavigableMap<Long, AuditEntry> chain : chains.values()) {
            chain.values().stream()
                    .filter(e -> e.getTimestamp() < cutoffTimestamp)
                    .map(InMemoryAuditEntryAccess::copy)
                    .forEach(result::add);
        }
        return result;
    }

    @Override
    public void delete(AuditEntry entry) {
        chain(entry.getTenantId()).remove(entry.getSequence());
    }

    private ConcurrentNavigableMap<Long, AuditEntry> chain(String tenantId) {
        return chains.computeIfAbsent(tenantId, t -> new ConcurrentSkipListMap<>());
    }

    // Entries are mutable beans; hand out copies so callers cannot rewrite stored history.
    private static AuditEntry copy(AuditEntry e) {
        AuditEntry c = new AuditEntry();
        c.setTenantId(e.getTenantId());
        c.setSequence(e.getSequence());
        c.setEntryId(e.getEntryId());
        c.setTimestamp(e.getTimestamp());
        c.setEventType(e.getEventType());
        c.setSeverity(e.getSeverity());
        c.setPrevHash(e.getPrevHash());
        c.setHash(e.getHash());
        c.setActorId(e.getActorId());
        c.setResourceType(e.getResourceType());
        c.setResourceId(e.getResourceId());
        c.setAction(e.getAction());
        c.setIpAddress(e.getIpAddress());
        c.setRequestId(e.getRequestId());
        c.setPayload(e.getPayload());
        c.setPayloadEncrypted(e.getPayloadEncrypted());
        return c;
    }
}
