package com.example.securitycore.access;

import com.example.securitycore.models.EncryptionKey;
import java.util.List;
import java.util.Optional;

/**
 * Storage abstraction for the {@code encryption_keys} table. A key version is the pair
 * (scope id, version). Both writes are conditional so two service instances cannot
 * overwrite each other's key material or lifecycle state.
 */
public interface EncryptionKeyAccess {

    /**
     * Stores a new version.
     *
     * @throws KeyVersionConflictException if the (scope, version) slot is already taken
     */
    void create(EncryptionKey key);

    /**
     * Replaces a stored version with its next lifecycle state.
     *
     * @throws KeyVersionConflictException if the stored version is missing or not in {@code expectedStatus}
     */
    void update(EncryptionKey key, EncryptionKey.Status expectedStatus);

    /**
     * All versions of a scope ordered by version ascending.
     */
    List<EncryptionKey> findByScope(String scopeId);

    Optional<EncryptionKey> findByKeyId(String keyId);

    List<EncryptionKey> findAll();
}
