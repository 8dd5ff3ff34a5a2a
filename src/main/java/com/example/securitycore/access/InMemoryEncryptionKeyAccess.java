package com.example.securitycore.access;

import com.example.securitycore.models.EncryptionKey;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "storage.backend", havingValue = "memory")
public class InMemoryEncryptionKeyAccess implements EncryptionKeyAccess {

    private record Slot(String scopeId, int version) {
    }

    private final Map<Slot, EncryptionKey> store = new ConcurrentHashMap<>();

    @Override
    public void create(EncryptionKey key) {
        EncryptionKey previous = store.putIfAbsent(slot(key), key.toBuilder().build());
        if (previous != null) {
            throw new KeyVersionConflictException(key.getScopeId(), key.getVersion(), null);
        }
    }

    @Override
    public void update(EncryptionKey key, EncryptionKey.Status expectedStatus) {
        boolean[] replaced = new boolean[1];
        store.computeIfPresent(slot(key), (slot, stored) -> {
            if (stored.getStatus() != expectedStatus) {
                return stored;
            }
            replaced[0] = true;
            return key.toBuilder().build();
        });
        if (!replaced[0]) {
            throw new KeyVersionConflictException(key.getScopeId(), key.getVersion(), null);
        }
    }

    @Override
    public List<EncryptionKey> findByScope(String scopeId) {
        return store.values().stream()
                .filter(k -> k.getScopeId().equals(scopeId))
                .sorted(Comparator.comparing(EncryptionKey::getVersion))
                .map(k -> k.toBuilder().build())
                .collect(Collectors.toList());
    }

    @Override
    public Optional<EncryptionKey> findByKeyId(String keyId) {
        return store.values().stream()
                .filter(k -> k.getKeyId().equals(keyId))
                .findFirst()
                .map(k -> k.toBuilder().build());
    }

    @Override
    public List<EncryptionKey> findAll() {
        return store.values().stream()
                .sorted(Comparator.comparing(EncryptionKey::getScopeId).thenComparing(EncryptionKey::getVersion))
                .map(k -> k.toBuilder().build())
                .collect(Collectors.toList());
    }

    private static Slot slot(EncryptionKey key) {
        return new Slot(key.getScopeId(), key.getVersion());
    }
}
