package com.cloudimages.config;

import com.cloudimages.exception.EncryptionException;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.util.Base64;

/**
 * Immutable holder for the symmetric key that protects provider credentials.
 * Built once at startup; {@link #toString()} never reveals key material.
 */
public final class VaultKey {

    private final SecretKey secretKey;

    private VaultKey(SecretKey secretKey) {
        this.secretKey = secretKey;
    }

    /**
     * Parses a Base64-encoded AES key.
     *
     * @throws EncryptionException if the key is absent, not Base64, or not 128/192/256 bits
     */
    public static VaultKey fromBase64(String encodedKey) {
        if (encodedKey == null || encodedKey.isBlank()) {
            throw new EncryptionException("Encryption key is not configured (app.encryption-key)");
        }
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(encodedKey.trim());
        } catch (IllegalArgumentException e) {
            throw new EncryptionException("Encryption key is not valid Base64");
        }
        if (keyBytes.length != 16 && keyBytes.length != 24 && keyBytes.length != 32) {
            throw new EncryptionException("Encryption key must be 16, 24 or 32 bytes, got " + keyBytes.length);
        }
        return new VaultKey(new SecretKeySpec(keyBytes, "AES"));
    }

    public SecretKey secretKey() {
        return secretKey;
    }

    @Override
    public String toString() {
        return "VaultKey[AES-" + (secretKey.getEncoded().length * 8) + "]";
    }
}
