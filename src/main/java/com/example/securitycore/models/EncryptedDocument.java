package com.example.securitycore.models;

import java.util.Objects;

/**
 * Envelope-encrypted payload: the document is sealed under a one-off data key, and that data
 * key is itself stored as an {@link EncryptedBlob} under the tenant's purpose key.
 */
public record EncryptedDocument(EncryptedBlob wrappedKey, byte[] nonce, byte[] ciphertext, byte[] tag) {

    public EncryptedDocument {
        Objects.requireNonNull(wrappedKey, "wrappedKey");
        nonce = Objects.requireNonNull(nonce, "nonce").clone();
        ciphertext = Objects.requireNonNull(ciphertext, "ciphertext").clone();
        tag = Objects.requireNonNull(tag, "tag").clone();
    }

    @Override
    public byte[] nonce() { return nonce.clone(); }

    @Override
    public byte[] ciphertext() { return ciphertext.clone(); }

    @Override
    public byte[] tag() { return tag.clone(); }

    @Override
    public String toString() {
        return "EncryptedDocument[wrappedKey=" + wrappedKey + ", length=" + ciphertext.length + "]";
    }
}
