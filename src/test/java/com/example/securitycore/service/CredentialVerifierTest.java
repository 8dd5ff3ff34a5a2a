package com.example.securitycore.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.securitycore.config.IdentityProperties;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CredentialVerifierTest {

    private static String aliceHash;

    @BeforeAll
    static void hash() {
        aliceHash = CredentialVerifier.hashPassword("correct horse battery staple");
    }

    private static CredentialVerifier verifier() {
        IdentityProperties.Account alice = new IdentityProperties.Account();
        alice.setTenantId("tenant-a");
        alice.setUserId("alice");
        alice.setPasswordHash(aliceHash);
        alice.setRoles(List.of("clinician"));
        IdentityProperties props = new IdentityProperties();
        props.setAccounts(List.of(alice));
        return new CredentialVerifier(props);
    }

    @Test
    @DisplayName("Hashes are salted PBKDF2 strings")
    void hashFormat() {
        String again = CredentialVerifier.hashPassword("correct horse battery staple");

        assertTrue(aliceHash.startsWith("pbkdf2-sha256$210000$"));
        assertEquals(4, aliceHash.split("\\$").length);
        assertNotEquals(aliceHash, again);
        assertTrue(CredentialVerifier.matches("correct horse battery staple", again));
    }

    @Test
    @DisplayName("Only the right password for the right tenant authenticates")
    void authenticate() {
        CredentialVerifier verifier = verifier();

        Optional<IdentityProperties.Account> ok = verifier.authenticate("tenant-a", "alice", "correct horse battery staple");
        assertTrue(ok.isPresent());
        assertEquals(List.of("clinician"), ok.get().getRoles());

        assertFalse(verifier.authenticate("tenant-a", "alice", "wrong").isPresent());
        assertFalse(verifier.authenticate("tenant-b", "alice", "correct horse battery staple").isPresent());
        assertFalse(verifier.authenticate("tenant-a", "mallory", "anything").isPresent());
        assertFalse(verifier.authenticate("tenant-a", "alice", null).isPresent());
    }

    @Test
    @DisplayName("Unknown hash formats are a configuration error")
    void badFormat() {
        assertThrows(IllegalStateException.class, () -> CredentialVerifier.matches("pw", "plain-text"));
    }
}
