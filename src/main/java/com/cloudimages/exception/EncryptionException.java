package com.cloudimages.exception;

/**
 * Thrown when the credential vault cannot encrypt, usually because the key is
 * missing or malformed at startup.
 */
public class EncryptionException extends CloudImagesException {

    public EncryptionException(String message) {
        super("encryption_error", message);
    }

    public EncryptionException(String message, Throwable cause) {
        super("encryption_error", message, cause);
    }
}
