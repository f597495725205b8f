package com.cloudimages.service;

import com.cloudimages.config.VaultKey;
import com.cloudimages.exception.DecryptionException;
import com.cloudimages.exception.EncryptionException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Service;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * AES-GCM encryption for storage provider credentials.
 *
 * Credential maps are serialized to JSON with sorted keys, encrypted with the
 * process-wide {@link VaultKey} and stored as Base64(IV + ciphertext + authTag).
 * A blob written under a different key fails the GCM tag check and is
 * reported as a {@link DecryptionException}.
 */
@Service
public class CredentialVault {

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12; // 96-bit IV for GCM
    private static final int GCM_TAG_LENGTH = 128; // 128-bit authentication tag
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final VaultKey vaultKey;
    private final ObjectMapper mapper = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    private final SecureRandom random = new SecureRandom();

    public CredentialVault(VaultKey vaultKey) {
        this.vaultKey = vaultKey;
    }

    /**
     * Encrypts a credential map.
     *
     * @param credentials provider-specific secrets, e.g. access keys
     * @return Base64-encoded ciphertext suitable for storage
     */
    public String encrypt(Map<String, Object> credentials) {
        if (credentials == null) {
            throw new IllegalArgumentException("Cannot encrypt null credentials");
        }
        try {
            byte[] plaintext = mapper.writeValueAsBytes(credentials);

            byte[] iv = new byte[GCM_IV_LENGTH];
            random.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, vaultKey.secretKey(), new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            byte[] ciphertext = cipher.doFinal(plaintext);

            byte[] combined = new byte[iv.length + ciphertext.length];
            System.arraycopy(iv, 0, combined, 0, iv.length);
            System.arraycopy(ciphertext, 0, combined, iv.length, ciphertext.length);

            return Base64.getEncoder().encodeToString(combined);
        } catch (Exception e) {
            throw new EncryptionException("Credential encryption failed", e);
        }
    }

    /**
     * Decrypts a blob produced by {@link #encrypt(Map)}.
     *
     * @throws DecryptionException if the blob is corrupt or was written under another key
     */
    public Map<String, Object> decrypt(String encryptedBase64) {
        if (encryptedBase64 == null || encryptedBase64.isBlank()) {
            throw new DecryptionException("No encrypted credentials to decrypt");
        }
        byte[] combined;
        try {
            combined = Base64.getDecoder().decode(encryptedBase64);
        } catch (IllegalArgumentException e) {
            throw new DecryptionException("Stored credentials are corrupt");
        }
        if (combined.length <= GCM_IV_LENGTH) {
            throw new DecryptionException("Stored credentials are corrupt");
        }

        byte[] plaintext;
        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, vaultKey.secretKey(),
                    new GCMParameterSpec(GCM_TAG_LENGTH, combined, 0, GCM_IV_LENGTH));
            plaintext = cipher.doFinal(combined, GCM_IV_LENGTH, combined.length - GCM_IV_LENGTH);
        } catch (AEADBadTagException e) {
            throw new DecryptionException("Stored credentials could not be decrypted; the encryption key may have rotated");
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("Stored credentials could not be decrypted", e);
        }

        try {
            return mapper.readValue(plaintext, MAP_TYPE);
        } catch (Exception e) {
            // The exception message could quote plaintext, so it is not chained.
            throw new DecryptionException("Decrypted credentials are not a valid JSON object");
        }
    }
}
