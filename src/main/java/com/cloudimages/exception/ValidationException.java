package com.cloudimages.exception;

/**
 * Thrown for caller-fixable input problems (shape, size, type).
 */
public class ValidationException extends CloudImagesException {

    public ValidationException(String message) {
        super("validation_error", message);
    }
}
