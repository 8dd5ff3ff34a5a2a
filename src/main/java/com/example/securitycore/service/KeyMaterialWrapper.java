package com.example.securitycore.service;

import com.example.securitycore.config.KeyManagementProperties;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import javax.crypto.AEADBadTagException;
import org.springframework.stereotype.Component;

/**
 * Wraps raw key material under the configured master key-encryption key before it is stored.
 * The wrapped form is {@code nonce.ciphertext.tag} in base64url and is bound to the key's
 * scope and version.
 */
@Component
public class KeyMaterialWrapper {

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final AesGcmCipher cipher;
    private final byte[] kek;

    public KeyMaterialWrapper(AesGcmCipher cipher, KeyManagementProperties properties) {
        this.cipher = cipher;
        String configured = properties.getMasterKey();
        if (configured == null || configured.isBlank()) {
            throw new IllegalStateException("security.keys.master-key must be set");
        }
        this.kek = Base64.getDecoder().decode(configured.trim());
        if (kek.length != AesGcmCipher.KEY_LENGTH) {
            throw new IllegalStateException("security.keys.master-key must decode to "
                    + AesGcmCipher.KEY_LENGTH + " bytes");
        }
    }

    public String wrap(byte[] material, String scopeId, int version) {
        AesGcmCipher.Sealed sealed = cipher.seal(kek, material, context(scopeId, version));
        return ENCODER.encodeToString(sealed.nonce()) + "."
                + ENCODER.encodeToString(sealed.ciphertext()) + "."
                + ENCODER.encodeToString(sealed.tag());
    }

    public byte[] unwrap(String wrapped, String scopeId, int version) {
        String[] parts = wrapped.split("\\.", -1);
        if (parts.length != 3) {
            throw new IllegalStateException("Wrapped material of " + scopeId + " v" + version + " is malformed");
        }
        try {
            return cipher.open(kek, DECODER.decode(parts[0]), DECODER.decode(parts[1]),
                    DECODER.decode(parts[2]), context(scopeId, version));
        } catch (AEADBadTagException e) {
            throw new IllegalStateException("Wrapped material of " + scopeId + " v" + version
                    + " does not authenticate under the master key", e);
        }
    }

    private static byte[] context(String scopeId, int version) {
        return ("kek|" + scopeId + "|" + version).getBytes(StandardCharsets.UTF_8);
    }
}
