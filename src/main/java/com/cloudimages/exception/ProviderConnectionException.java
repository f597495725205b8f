package com.cloudimages.exception;

/**
 * Thrown when a remote storage system is unreachable, times out or rejects
 * the credentials.
 */
public class ProviderConnectionException extends CloudImagesException {

    public ProviderConnectionException(String message) {
        super("provider_connection_error", message);
    }

    public ProviderConnectionException(String message, Throwable cause) {
        super("provider_connection_error", message, cause);
    }
}
