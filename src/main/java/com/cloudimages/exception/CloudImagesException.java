package com.cloudimages.exception;

/**
 * Base exception for all CloudImages operations. Carries a stable error code
 * that the REST layer returns to clients.
 */
public abstract class CloudImagesException extends RuntimeException {

    private final String errorCode;

    protected CloudImagesException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected CloudImagesException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
