package com.example.securitycore.service;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import javax.crypto.AEADBadTagException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AesGcmCipherTest {

    private final AesGcmCipher cipher = new AesGcmCipher();
    private final byte[] aad = "ctx".getBytes(StandardCharsets.UTF_8);

    @Test
    @DisplayName("Seal then open returns the plaintext; nonce and tag have fixed lengths")
    void sealOpen() throws Exception {
        byte[] key = cipher.newKey();
        byte[] plaintext = "123-45-6789".getBytes(StandardCharsets.UTF_8);

        AesGcmCipher.Sealed sealed = cipher.seal(key, plaintext, aad);

        assertEquals(AesGcmCipher.NONCE_LENGTH, sealed.nonce().length);
        assertEquals(AesGcmCipher.TAG_LENGTH, sealed.tag().length);
        assertEquals(plaintext.length, sealed.ciphertext().length);
        assertArrayEquals(plaintext, cipher.open(key, sealed.nonce(), sealed.ciphertext(), sealed.tag(), aad));
    }

    @Test
    @DisplayName("Same plaintext under the same key gives different nonces and ciphertexts")
    void freshNonce() {
        byte[] key = cipher.newKey();
        byte[] plaintext = "same".getBytes(StandardCharsets.UTF_8);

        AesGcmCipher.Sealed a = cipher.seal(key, plaintext, aad);
        AesGcmCipher.Sealed b = cipher.seal(key, plaintext, aad);

        assertFalse(Arrays.equals(a.nonce(), b.nonce()));
        assertFalse(Arrays.equals(a.ciphertext(), b.ciphertext()));
    }

    @Test
    @DisplayName("Wrong associated data, wrong key and short tag all fail authentication")
    void authenticationFailures() {
        byte[] key = cipher.newKey();
        AesGcmCipher.Sealed sealed = cipher.seal(key, new byte[] {1, 2, 3}, aad);

        assertThrows(AEADBadTagException.class, () ->
                cipher.open(key, sealed.nonce(), sealed.ciphertext(), sealed.tag(), "other".getBytes(StandardCharsets.UTF_8)));
        assertThrows(AEADBadTagException.class, () ->
                cipher.open(cipher.newKey(), sealed.nonce(), sealed.ciphertext(), sealed.tag(), aad));
        assertThrows(AEADBadTagException.class, () ->
                cipher.open(key, sealed.nonce(), sealed.ciphertext(), Arrays.copyOf(sealed.tag(), 8), aad));
    }

    @Test
    @DisplayName("Keys must be 256 bits")
    void keyLength() {
        assertThrows(IllegalArgumentException.class, () -> cipher.seal(new byte[16], new byte[1], aad));
    }
}
