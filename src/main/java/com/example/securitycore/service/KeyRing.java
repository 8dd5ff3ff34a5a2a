package com.example.securitycore.service;

import com.example.securitycore.models.EncryptionKey;
import com.example.securitycore.models.KeyScope;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * All versions of one key scope. Readers see an immutable {@link Snapshot} through a single
 * atomic read, so the active key can never be observed half rotated. Writers build a new
 * snapshot while holding the ring's monitor and swap it in.
 */
class KeyRing {

    /**
     * Versions ordered by version number, plus the index of the ACTIVE one ({@code -1} if none).
     */
    record Snapshot(List<EncryptionKey> versions, int activeIndex) {

        Snapshot {
            versions = List.copyOf(versions);
        }

        Optional<EncryptionKey> active() {
            return activeIndex < 0 ? Optional.empty() : Optional.of(versions.get(activeIndex));
        }

        Optional<EncryptionKey> version(int version) {
            // versions are dense and 1-based
            int idx = version - 1;
            if (idx < 0 || idx >= versions.size()) {
                return Optional.empty();
            }
            EncryptionKey key = versions.get(idx);
            return key.getVersion() == version ? Optional.of(key) : Optional.empty();
        }

        Optional<EncryptionKey> byKeyId(String keyId) {
            return versions.stream().filter(k -> k.getKeyId().equals(keyId)).findFirst();
        }

        int nextVersion() {
            return versions.size() + 1;
        }

        Snapshot replace(EncryptionKey updated) {
            List<EncryptionKey> copy = new ArrayList<>(versions);
            copy.set(updated.getVersion() - 1, updated);
            return new Snapshot(copy, indexOfActive(copy));
        }

        Snapshot append(EncryptionKey added) {
            List<EncryptionKey> copy = new ArrayList<>(versions);
            copy.add(added);
            return new Snapshot(copy, indexOfActive(copy));
        }
    }

    private final KeyScope scope;
    private final AtomicReference<Snapshot> current;
    private final Map<Integer, byte[]> material = new HashMap<>();
    private final Object materialLock = new Object();

    KeyRing(KeyScope scope, List<EncryptionKey> stored) {
        this.scope = scope;
        this.current = new AtomicReference<>(snapshotOf(stored));
    }

    KeyScope scope() {
        return scope;
    }

    Snapshot snapshot() {
        return current.get();
    }

    /** Callers hold this ring's monitor. */
    void swap(Snapshot next) {
        current.set(next);
    }

    /**
     * Replaces the snapshot with what storage holds now, after another writer changed the scope.
     * Material of versions that are no longer decryptable is wiped. Callers hold this ring's monitor.
     */
    void reload(List<EncryptionKey> stored) {
        Snapshot next = snapshotOf(stored);
        current.set(next);
        for (EncryptionKey key : next.versions()) {
            if (!key.getStatus().usableForDecryption()) {
                forgetMaterial(key.getVersion());
            }
        }
    }

    /**
     * Raw material of {@code version}, unwrapped on first use. Callers get their own copy.
     *
     * @throws KeyUnavailableException if the version is no longer decryptable
     */
    byte[] material(int version, Function<EncryptionKey, byte[]> unwrap) {
        synchronized (materialLock) {
            // Status is read under the same lock forgetMaterial takes, so a revoked key is never re-cached.
            EncryptionKey key = current.get().version(version)
                    .orElseThrow(() -> KeyNotFoundException.byVersion(scope.id(), version));
            byte[] raw = material.get(version);
            if (raw == null) {
                if (!key.getStatus().usableForDecryption() || key.getWrappedMaterial() == null) {
                    throw KeyUnavailableException.of(key);
                }
                raw = unwrap.apply(key);
                material.put(version, raw);
            }
            return raw.clone();
        }
    }

    void cacheMaterial(int version, byte[] raw) {
        synchronized (materialLock) {
            material.put(version, raw.clone());
        }
    }

    /**
     * Drops the cached material of {@code version} and overwrites it with zeros.
     *
     * @return true if material was cached
     */
    boolean forgetMaterial(int version) {
        synchronized (materialLock) {
            byte[] raw = material.remove(version);
            if (raw == null) {
                return false;
            }
            Arrays.fill(raw, (byte) 0);
            return true;
        }
    }

    private static Snapshot snapshotOf(List<EncryptionKey> stored) {
        List<EncryptionKey> sorted = new ArrayList<>(stored);
        sorted.sort(Comparator.comparing(EncryptionKey::getVersion));
        return new Snapshot(sorted, indexOfActive(sorted));
    }

    // If a crash left two ACTIVE rows behind, the highest version wins.
    private static int indexOfActive(List<EncryptionKey> versions) {
        for (int i = versions.size() - 1; i >= 0; i--) {
            if (versions.get(i).getStatus() == EncryptionKey.Status.ACTIVE) {
                return i;
            }
        }
        return -1;
    }
}
