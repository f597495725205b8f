package com.cloudimages.exception;

public class InternalException extends CloudImagesException {

    public InternalException(String message) {
        super("internal_error", message);
    }

    public InternalException(String message, Throwable cause) {
        super("internal_error", message, cause);
    }
}
