package com.example.securitycore.models;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * Output of field encryption. Carries everything needed to find the key again
 * (tenant, purpose, key version) next to the nonce, ciphertext and GCM tag.
 *
 * <p>Wire form: {@code esc1:<tenant>:<purpose>:<version>:<nonce>:<ciphertext>:<tag>} where the
 * tenant, purpose, nonce, ciphertext and tag segments are unpadded base64url.
 */
public record EncryptedBlob(
        String tenantId,
        String purpose,
        int keyVersion,
        byte[] nonce,
        byte[] ciphertext,
        byte[] tag
) {

    public static final String FORMAT_PREFIX = "esc1";

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    public EncryptedBlob {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(purpose, "purpose");
        Objects.requireNonNull(nonce, "nonce");
        Objects.requireNonNull(ciphertext, "ciphertext");
        Objects.requireNonNull(tag, "tag");
        if (keyVersion < 1) {
            throw new IllegalArgumentException("keyVersion must be >= 1");
        }
        nonce = nonce.clone();
        ciphertext = ciphertext.clone();
        tag = tag.clone();
    }

    @Override
    public byte[] nonce() { return nonce.clone(); }

    @Override
    public byte[] ciphertext() { return ciphertext.clone(); }

    @Override
    public byte[] tag() { return tag.clone(); }

    public String encode() {
        return String.join(":",
                FORMAT_PREFIX,
                ENCODER.encodeToString(tenantId.getBytes(StandardCharsets.UTF_8)),
                ENCODER.encodeToString(purpose.getBytes(StandardCharsets.UTF_8)),
                Integer.toString(keyVersion),
                ENCODER.encodeToString(nonce),
                ENCODER.encodeToString(ciphertext),
                ENCODER.encodeToString(tag));
    }

    /**
     * @throws IllegalArgumentException if the value is not a well-formed blob
     */
    public static EncryptedBlob parse(String encoded) {
        if (encoded == null) {
            throw new IllegalArgumentException("Encrypted value is missing");
        }
        String[] parts = encoded.split(":", -1);
        if (parts.length != 7 || !FORMAT_PREFIX.equals(parts[0])) {
            throw new IllegalArgumentException("Unrecognised encrypted value format");
        }
        try {
            return new EncryptedBlob(
                    new String(DECODER.decode(parts[1]), StandardCharsets.UTF_8),
                    new String(DECODER.decode(parts[2]), StandardCharsets.UTF_8),
                    Integer.parseInt(parts[3]),
                    DECODER.decode(parts[4]),
                    DECODER.decode(parts[5]),
                    DECODER.decode(parts[6]));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Unrecognised encrypted value format", ex);
        }
    }

    /**
     * Associated data bound into the GCM tag, so a blob cannot be replayed under another
     * tenant, purpose or key version.
     */
    public static byte[] associatedData(String tenantId, String purpose, int keyVersion) {
        return (FORMAT_PREFIX + "|" + tenantId + "|" + purpose + "|" + keyVersion)
                .getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EncryptedBlob other)) {
            return false;
        }
        return keyVersion == other.keyVersion
                && tenantId.equals(other.tenantId)
                && purpose.equals(other.purpose)
                && Arrays.equals(nonce, other.nonce)
                && Arrays.equals(ciphertext, other.ciphertext)
                && Arrays.equals(tag, other.tag);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(tenantId, purpose, keyVersion);
        result = 31 * result + Arrays.hashCode(nonce);
        result = 31 * result + Arrays.hashCode(ciphertext);
        return 31 * result + Arrays.hashCode(tag);
    }

    @Override
    public String toString() {
        return "EncryptedBlob[tenantId=" + tenantId + ", purpose=" + purpose + ", keyVersion=" + keyVersion + "]";
    }
}
