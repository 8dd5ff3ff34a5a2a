package com.example.securitycore.service;

import com.example.securitycore.access.EncryptionKeyAccess;
import com.example.securitycore.access.KeyVersionConflictException;
import com.example.securitycore.config.KeyManagementProperties;
import com.example.securitycore.models.AuditEntry;
import com.example.securitycore.models.EncryptionKey;
import com.example.securitycore.models.KeyScope;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Owns the lifecycle of every key version: GENERATED, ACTIVE, DEPRECATED, REVOKED, DESTROYED.
 *
 * <p>Each scope lives in a {@link KeyRing}. Lifecycle changes for a scope are serialised on the
 * ring's monitor, persisted, then published with one snapshot swap; readers never lock.
 * Audit events are written after the monitor is released.
 *
 * <p>Writes are conditional. When another instance changed the scope first, the ring is
 * reloaded from storage and the change is decided again against the fresh state.
 */
@Service
@Slf4j
public class KeyManagementService {

    private static final String SYSTEM_ACTOR = "system";
    private static final int MAX_WRITE_ATTEMPTS = 5;

    private final EncryptionKeyAccess keyAccess;
    private final KeyMaterialWrapper wrapper;
    private final AesGcmCipher cipher;
    private final AuditLogService auditLogService;
    private final KeyManagementProperties properties;
    private final Clock clock;

    private final Map<String, KeyRing> rings = new ConcurrentHashMap<>();
    private final Map<String, String> scopeByKeyId = new ConcurrentHashMap<>();

    public KeyManagementService(EncryptionKeyAccess keyAccess,
                                KeyMaterialWrapper wrapper,
                                AesGcmCipher cipher,
                                AuditLogService auditLogService,
                                KeyManagementProperties properties,
                                Clock clock) {
        this.keyAccess = keyAccess;
        this.wrapper = wrapper;
        this.cipher = cipher;
        this.auditLogService = auditLogService;
        this.properties = properties;
        this.clock = clock;
    }

    /** Key version plus its unwrapped material; only handed to {@link EncryptionService}. */
    record ResolvedKey(EncryptionKey key, byte[] material) {
    }

    /**
     * Creates the next version of a scope and makes it ACTIVE. The previous ACTIVE version,
     * if any, becomes DEPRECATED in the same snapshot swap.
     */
    public EncryptionKey generateKey(EncryptionKey.KeyType type, String purpose, String tenantId, String actorId) {
        KeyScope scope = new KeyScope(type, purpose, tenantId);
        KeyRing ring = ring(scope);
        Transition t = mutate(ring, this::activateNextVersion);
        publish(t, actorId, AuditEntry.EventType.KEY_GENERATED);
        return t.activated();
    }

    /**
     * Rotates the scope of {@code keyId}. If that key is no longer ACTIVE someone already rotated
     * it, and the current ACTIVE key is returned unchanged.
     */
    public EncryptionKey rotateKey(String keyId, String actorId) {
        KeyRing ring = ringOf(keyId);
        Transition t = mutate(ring, r -> {
            EncryptionKey active = r.snapshot().active().orElse(null);
            if (active != null && !active.getKeyId().equals(keyId)) {
                log.info("Key {} already rotated; active version of {} is {}",
                        keyId, r.scope().id(), active.getVersion());
                return null;
            }
            return activateNextVersion(r);
        });
        if (t == null) {
            return ring.snapshot().active().orElseThrow(() -> KeyNotFoundException.noActiveKey(ring.scope().id()));
        }
        publish(t, actorId, AuditEntry.EventType.KEY_ROTATED);
        return t.activated();
    }

    /**
     * ACTIVE keys older than their rotation period.
     */
    public List<EncryptionKey> checkRotationNeeded() {
        long now = clock.millis();
        List<EncryptionKey> due = new ArrayList<>();
        for (KeyRing ring : allRings()) {
            ring.snapshot().active()
                    .filter(k -> k.getCreatedAt() + properties.rotationPeriod(k.getKeyType()).toMillis() <= now)
                    .ifPresent(due::add);
        }
        return due;
    }

    /**
     * Moves a key to REVOKED. Revoking the ACTIVE key rotates its scope first, so the scope
     * keeps an ACTIVE key. Revoking an already revoked key changes nothing.
     */
    public EncryptionKey revokeKey(String keyId, String reason, String actorId) {
        KeyRing ring = ringOf(keyId);
        // survives a retry, so a rotation that was persisted is still audited
        Transition[] rotation = new Transition[1];
        EncryptionKey revoked = mutate(ring, r -> {
            EncryptionKey key = versionOf(r, keyId);
            if (key.getStatus() == EncryptionKey.Status.REVOKED) {
                return null;
            }
            if (key.getStatus() == EncryptionKey.Status.ACTIVE) {
                rotation[0] = activateNextVersion(r);
                key = versionOf(r, keyId);
            }
            requireTransition(key, EncryptionKey.Status.REVOKED);
            EncryptionKey updated = key.toBuilder()
                    .status(EncryptionKey.Status.REVOKED)
                    .revokedAt(clock.millis())
                    .revocationReason(reason)
                    .build();
            store(r, updated, key.getStatus());
            r.forgetMaterial(updated.getVersion());
            return updated;
        });
        if (rotation[0] != null) {
            publish(rotation[0], actorId, AuditEntry.EventType.KEY_ROTATED);
        }
        if (revoked == null) {
            return versionOf(ring, keyId);
        }
        log.info("Revoked key {} (scope {}, version {})", keyId, revoked.getScopeId(), revoked.getVersion());
        auditLogService.logKeyEvent(AuditEntry.EventType.KEY_REVOKED, revoked, actorId,
                reason == null ? Map.of() : Map.of("reason", reason));
        return revoked;
    }

    /**
     * Destroys a REVOKED key. The confirmation must read {@code DESTROY:<keyId>:<version>}.
     * The wrapped material is wiped; data encrypted under the key becomes unrecoverable.
     */
    public EncryptionKey destroyKey(String keyId, String confirmation, String actorId) {
        KeyRing ring = ringOf(keyId);
        boolean[] wiped = new boolean[1];
        EncryptionKey destroyed = mutate(ring, r -> {
            EncryptionKey key = versionOf(r, keyId);
            requireTransition(key, EncryptionKey.Status.DESTROYED);
            if (!destructionToken(key).equals(confirmation)) {
                throw KeyLifecycleException.invalidConfirmation(keyId);
            }
            EncryptionKey updated = key.toBuilder()
                    .status(EncryptionKey.Status.DESTROYED)
                    .wrappedMaterial(null)
                    .destroyedAt(clock.millis())
                    .destroyedBy(actorId)
                    .build();
            store(r, updated, EncryptionKey.Status.REVOKED);
            wiped[0] = r.forgetMaterial(updated.getVersion());
            return updated;
        });
        log.warn("Destroyed key {} (scope {}, version {}) on request of {}{}",
                keyId, destroyed.getScopeId(), destroyed.getVersion(), actorId,
                wiped[0] ? "; cached material wiped" : "");
        auditLogService.logKeyEvent(AuditEntry.EventType.KEY_DESTROYED, destroyed, actorId, Map.of());
        return destroyed;
    }

    /**
     * Revokes DEPRECATED keys whose grace period has elapsed, one audited transition per key.
     */
    public List<EncryptionKey> revokeExpiredDeprecatedKeys() {
        long cutoff = clock.millis() - properties.getRotation().getDeprecatedGracePeriod().toMillis();
        List<EncryptionKey> revoked = new ArrayList<>();
        for (KeyRing ring : allRings()) {
            for (EncryptionKey key : ring.snapshot().versions()) {
                if (key.getStatus() == EncryptionKey.Status.DEPRECATED
                        && key.getDeprecatedAt() != null
                        && key.getDeprecatedAt() <= cutoff) {
                    revoked.add(revokeKey(key.getKeyId(), "deprecation grace period elapsed", SYSTEM_ACTOR));
                }
            }
        }
        return revoked;
    }

    public EncryptionKey getKey(String keyId) {
        return versionOf(ringOf(keyId), keyId);
    }

    /**
     * Keys filtered by tenant, type and status; null filters match everything.
     */
    public List<EncryptionKey> listKeys(String tenantId, EncryptionKey.KeyType type, EncryptionKey.Status status) {
        return allRings().stream()
                .flatMap(r -> r.snapshot().versions().stream())
                .filter(k -> tenantId == null || tenantId.equals(k.getTenantId()))
                .filter(k -> type == null || type == k.getKeyType())
                .filter(k -> status == null || status == k.getStatus())
                .collect(Collectors.toList());
    }

    public KeyUsageReport keyUsageReport(String tenantId, long periodStart, long periodEnd) {
        List<EncryptionKey> keys = listKeys(tenantId, null, null);
        Map<EncryptionKey.KeyType, Long> byType = new EnumMap<>(EncryptionKey.KeyType.class);
        Map<EncryptionKey.Status, Long> byStatus = new EnumMap<>(EncryptionKey.Status.class);
        long generated = 0;
        long rotations = 0;
        long revocations = 0;
        long destructions = 0;
        for (EncryptionKey k : keys) {
            byType.merge(k.getKeyType(), 1L, Long::sum);
            byStatus.merge(k.getStatus(), 1L, Long::sum);
            if (within(k.getCreatedAt(), periodStart, periodEnd)) {
                generated++;
                if (k.getVersion() > 1) {
                    rotations++;
                }
            }
            if (within(k.getRevokedAt(), periodStart, periodEnd)) {
                revocations++;
            }
            if (within(k.getDestroyedAt(), periodStart, periodEnd)) {
                destructions++;
            }
        }
        long due = checkRotationNeeded().stream()
                .filter(k -> tenantId == null || tenantId.equals(k.getTenantId()))
                .count();
        return new KeyUsageReport(tenantId, periodStart, periodEnd, keys.size(), byType, byStatus,
                generated, rotations, revocations, destructions, due);
    }

    public static String destructionToken(EncryptionKey key) {
        return "DESTROY:" + key.getKeyId() + ":" + key.getVersion();
    }

    // ---- material access for EncryptionService ----

    /**
     * The ACTIVE DATA key of (purpose, tenant), provisioning version 1 on first use when enabled.
     */
    ResolvedKey activeDataKey(String purpose, String tenantId) {
        KeyScope scope = KeyScope.data(purpose, tenantId);
        KeyRing ring = ring(scope);
        Optional<EncryptionKey> active = ring.snapshot().active();
        if (active.isEmpty()) {
            if (!properties.isAutoProvision()) {
                throw KeyNotFoundException.noActiveKey(scope.id());
            }
            provisionFirstVersion(ring);
            active = ring.snapshot().active();
        }
        EncryptionKey key = active.orElseThrow(() -> KeyNotFoundException.noActiveKey(scope.id()));
        return new ResolvedKey(key, material(ring, key));
    }

    /**
     * A specific DATA key version for decryption. DEPRECATED versions are allowed.
     */
    ResolvedKey dataKeyVersion(String purpose, String tenantId, int version) {
        KeyScope scope = KeyScope.data(purpose, tenantId);
        KeyRing ring = ring(scope);
        if (ring.snapshot().version(version).isEmpty()) {
            // may have been created by another instance since the ring was loaded
            reload(ring);
        }
        EncryptionKey key = ring.snapshot().version(version)
                .orElseThrow(() -> KeyNotFoundException.byVersion(scope.id(), version));
        if (!key.getStatus().usableForDecryption()) {
            throw KeyUnavailableException.of(key);
        }
        return new ResolvedKey(key, material(ring, key));
    }

    // ---- internals ----

    private record Transition(EncryptionKey activated, EncryptionKey deprecated) {
    }

    private void provisionFirstVersion(KeyRing ring) {
        Transition t = mutate(ring, r -> r.snapshot().active().isEmpty() ? activateNextVersion(r) : null);
        if (t != null) {
            log.info("Provisioned first key for scope {}", ring.scope().id());
            publish(t, SYSTEM_ACTOR, AuditEntry.EventType.KEY_GENERATED);
        }
    }

    /** Caller holds the ring's monitor. */
    private Transition activateNextVersion(KeyRing ring) {
        KeyRing.Snapshot snapshot = ring.snapshot();
        KeyScope scope = ring.scope();
        long now = clock.millis();
        int version = snapshot.nextVersion();

        byte[] material = cipher.newKey();
        EncryptionKey activated;
        EncryptionKey deprecated;
        KeyRing.Snapshot next;
        try {
            EncryptionKey generated = EncryptionKey.builder()
                    .scopeId(scope.id())
                    .version(version)
                    .keyId(UUID.randomUUID().toString())
                    .keyType(scope.type())
                    .purpose(scope.purpose())
                    .tenantId(scope.tenantId())
                    .status(EncryptionKey.Status.GENERATED)
                    .createdAt(now)
                    .notAfter(now + properties.rotationPeriod(scope.type()).toMillis())
                    .wrappedMaterial(wrapper.wrap(material, scope.id(), version))
                    .build();
            requireTransition(generated, EncryptionKey.Status.ACTIVE);
            activated = generated.toBuilder()
                    .status(EncryptionKey.Status.ACTIVE)
                    .activatedAt(now)
                    .build();

            deprecated = snapshot.active()
                    .map(previous -> {
                        requireTransition(previous, EncryptionKey.Status.DEPRECATED);
                        return previous.toBuilder()
                                .status(EncryptionKey.Status.DEPRECATED)
                                .deprecatedAt(now)
                                .build();
                    })
                    .orElse(null);

            // New version first: a failure in between leaves two ACTIVE rows, and the ring
            // resolves that to the newer one on reload.
            keyAccess.create(activated);
            next = snapshot.append(activated);
            if (deprecated != null) {
                keyAccess.update(deprecated, EncryptionKey.Status.ACTIVE);
                next = next.replace(deprecated);
            }
            ring.cacheMaterial(version, material);
        } finally {
            Arrays.fill(material, (byte) 0);
        }
        ring.swap(next);
        scopeByKeyId.put(activated.getKeyId(), scope.id());
        return new Transition(activated, deprecated);
    }

    private void publish(Transition t, String actorId, AuditEntry.EventType type) {
        EncryptionKey key = t.activated();
        log.info("Activated key {} (scope {}, version {})", key.getKeyId(), key.getScopeId(), key.getVersion());
        Map<String, Object> details = new HashMap<>();
        if (t.deprecated() != null) {
            details.put("previous_key_id", t.deprecated().getKeyId());
            details.put("previous_version", t.deprecated().getVersion());
        }
        auditLogService.logKeyEvent(type, key, actorId, details);
    }

    /**
     * Runs {@code change} under the ring's monitor. A conditional write that loses to another
     * instance reloads the ring and runs {@code change} again on the fresh state.
     */
    private <T> T mutate(KeyRing ring, Function<KeyRing, T> change) {
        for (int attempt = 1; ; attempt++) {
            synchronized (ring) {
                try {
                    return change.apply(ring);
                } catch (KeyVersionConflictException ex) {
                    if (attempt >= MAX_WRITE_ATTEMPTS) {
                        throw KeyLifecycleException.concurrentModification(ring.scope().id(), ex);
                    }
                    log.info("Key scope {} was changed by another writer; reloading (attempt {})",
                            ring.scope().id(), attempt);
                    reload(ring);
                }
            }
        }
    }

    private void reload(KeyRing ring) {
        String scopeId = ring.scope().id();
        synchronized (ring) {
            List<EncryptionKey> stored = keyAccess.findByScope(scopeId);
            stored.forEach(k -> scopeByKeyId.put(k.getKeyId(), scopeId));
            ring.reload(stored);
        }
    }

    /** Caller holds the ring's monitor. */
    private void store(KeyRing ring, EncryptionKey updated, EncryptionKey.Status expectedStatus) {
        keyAccess.update(updated, expectedStatus);
        ring.swap(ring.snapshot().replace(updated));
    }

    private byte[] material(KeyRing ring, EncryptionKey key) {
        return ring.material(key.getVersion(),
                k -> wrapper.unwrap(k.getWrappedMaterial(), k.getScopeId(), k.getVersion()));
    }

    private static void requireTransition(EncryptionKey key, EncryptionKey.Status target) {
        if (!key.getStatus().canTransitionTo(target)) {
            throw KeyLifecycleException.illegalTransition(key, target);
        }
    }

    private static boolean within(Long timestamp, long start, long end) {
        return timestamp != null && timestamp >= start && timestamp < end;
    }

    private static EncryptionKey versionOf(KeyRing ring, String keyId) {
        return ring.snapshot().byKeyId(keyId).orElseThrow(() -> KeyNotFoundException.byId(keyId));
    }

    private KeyRing ring(KeyScope scope) {
        return rings.computeIfAbsent(scope.id(), id -> load(scope));
    }

    private KeyRing load(KeyScope scope) {
        List<EncryptionKey> stored = keyAccess.findByScope(scope.id());
        stored.forEach(k -> scopeByKeyId.put(k.getKeyId(), scope.id()));
        log.debug("Loaded {} key versions for scope {}", stored.size(), scope.id());
        return new KeyRing(scope, stored);
    }

    private KeyRing ringOf(String keyId) {
        String scopeId = scopeByKeyId.get(keyId);
        if (scopeId != null && rings.containsKey(scopeId)) {
            return rings.get(scopeId);
        }
        EncryptionKey stored = keyAccess.findByKeyId(keyId).orElseThrow(() -> KeyNotFoundException.byId(keyId));
        KeyRing ring = ring(stored.scope());
        if (ring.snapshot().byKeyId(keyId).isEmpty()) {
            reload(ring);
        }
        return ring;
    }

    // Every scope known to storage, loaded into rings.
    private List<KeyRing> allRings() {
        Map<String, EncryptionKey> scopes = keyAccess.findAll().stream()
                .collect(Collectors.toMap(EncryptionKey::getScopeId, Function.identity(), (a, b) -> a));
        scopes.values().forEach(k -> ring(k.scope()));
        return new ArrayList<>(rings.values());
    }
}
