package com.example.securitycore.service;

import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.stereotype.Component;

/**
 * AES-256-GCM with a fresh 96-bit nonce per call and a 128-bit tag. The JCE appends the
 * tag to the ciphertext; {@link Sealed} keeps the two apart so callers can store them
 * separately.
 */
@Component
public class AesGcmCipher {

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    public static final int KEY_LENGTH = 32; // 256 bits
    public static final int NONCE_LENGTH = 12; // 96 bits
    public static final int TAG_LENGTH = 16; // 128 bits

    private final SecureRandom random = new SecureRandom();

    public record Sealed(byte[] nonce, byte[] ciphertext, byte[] tag) {
    }

    public byte[] newKey() {
        byte[] key = new byte[KEY_LENGTH];
        random.nextBytes(key);
        return key;
    }

    public Sealed seal(byte[] key, byte[] plaintext, byte[] associatedData) {
        checkKey(key);
        byte[] nonce = new byte[NONCE_LENGTH];
        random.nextBytes(nonce);
        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"),
                    new GCMParameterSpec(TAG_LENGTH * 8, nonce));
            cipher.updateAAD(associatedData);
            byte[] out = cipher.doFinal(plaintext);
            int split = out.length - TAG_LENGTH;
            return new Sealed(nonce, Arrays.copyOfRange(out, 0, split), Arrays.copyOfRange(out, split, out.length));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption failed", e);
        }
    }

    /**
     * @throws AEADBadTagException if the tag does not authenticate ciphertext and associated data
     */
    public byte[] open(byte[] key, byte[] nonce, byte[] ciphertext, byte[] tag, byte[] associatedData)
            throws AEADBadTagException {
        checkKey(key);
        if (nonce.length != NONCE_LENGTH || tag.length != TAG_LENGTH) {
            throw new AEADBadTagException("Nonce or tag has the wrong length");
        }
        byte[] input = new byte[ciphertext.length + tag.length];
        System.arraycopy(ciphertext, 0, input, 0, ciphertext.length);
        System.arraycopy(tag, 0, input, ciphertext.length, tag.length);
        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"),
                    new GCMParameterSpec(TAG_LENGTH * 8, nonce));
            cipher.updateAAD(associatedData);
            return cipher.doFinal(input);
        } catch (AEADBadTagException e) {
            throw e;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM decryption failed", e);
        }
    }

    private static void checkKey(byte[] key) {
        if (key == null || key.length != KEY_LENGTH) {
            throw new IllegalArgumentException("Key length must be " + KEY_LENGTH + " bytes (256 bits)");
        }
    }
}
