package com.example.securitycore.service;

import com.example.securitycore.config.IdentityProperties;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.security.spec.KeySpec;
import java.util.Base64;
import java.util.Optional;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import org.springframework.stereotype.Service;

/**
 * Checks login credentials against the configured accounts using PBKDF2-HMAC-SHA256.
 * Unknown users cost the same hash computation as known ones.
 */
@Service
public class CredentialVerifier {

    private static final String PREFIX = "pbkdf2-sha256";
    private static final int DEFAULT_ITERATIONS = 210_000;
    private static final int HASH_BITS = 256;

    private final IdentityProperties properties;
    private final String decoyHash;

    public CredentialVerifier(IdentityProperties properties) {
        this.properties = properties;
        this.decoyHash = hashPassword("decoy-password");
    }

    public Optional<IdentityProperties.Account> authenticate(String tenantId, String userId, String password) {
        Optional<IdentityProperties.Account> account = properties.getAccounts().stream()
                .filter(a -> a.getTenantId().equals(tenantId) && a.getUserId().equals(userId))
                .findFirst();
        String stored = account.map(IdentityProperties.Account::getPasswordHash).orElse(decoyHash);
        boolean matches = matches(password == null ? "" : password, stored);
        return matches ? account : Optional.empty();
    }

    public static String hashPassword(String password) {
        byte[] salt = new byte[16];
        new SecureRandom().nextBytes(salt);
        return PREFIX + "$" + DEFAULT_ITERATIONS + "$"
                + Base64.getEncoder().encodeToString(salt) + "$"
                + Base64.getEncoder().encodeToString(derive(password, salt, DEFAULT_ITERATIONS));
    }

    static boolean matches(String password, String stored) {
        String[] parts = stored == null ? new String[0] : stored.split("\\$");
        if (parts.length != 4 || !PREFIX.equals(parts[0])) {
            throw new IllegalStateException("Unsupported password hash format");
        }
        byte[] salt = Base64.getDecoder().decode(parts[2]);
        byte[] expected = Base64.getDecoder().decode(parts[3]);
        return MessageDigest.isEqual(expected, derive(password, salt, Integer.parseInt(parts[1])));
    }

    private static byte[] derive(String password, byte[] salt, int iterations) {
        try {
            KeySpec spec = new PBEKeySpec(password.toCharArray(), salt, iterations, HASH_BITS);
            return SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256").generateSecret(spec).getEncoded();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("PBKDF2 not available", e);
        }
    }
}
