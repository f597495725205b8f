package com.cloudimages.exception;

/**
 * Thrown when an operation is blocked by existing state, e.g. deleting a
 * provider that images still reference.
 */
public class ConflictException extends CloudImagesException {

    public ConflictException(String message) {
        super("conflict", message);
    }
}
