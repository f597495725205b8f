package com.cloudimages.exception;

/**
 * Thrown when stored credentials cannot be decrypted: the key has rotated or
 * the ciphertext is corrupt. Never carries credential material.
 */
public class DecryptionException extends CloudImagesException {

    public DecryptionException(String message) {
        super("decryption_error", message);
    }

    public DecryptionException(String message, Throwable cause) {
        super("decryption_error", message, cause);
    }
}
