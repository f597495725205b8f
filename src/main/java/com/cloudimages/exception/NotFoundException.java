package com.cloudimages.exception;

/**
 * Thrown when a provider or image does not exist or is not owned by the caller.
 */
public class NotFoundException extends CloudImagesException {

    public NotFoundException(String message) {
        super("not_found", message);
    }

    public static NotFoundException provider(Long id) {
        return new NotFoundException("Storage provider not found: " + id);
    }

    public static NotFoundException image(Long id) {
        return new NotFoundException("Image not found: " + id);
    }
}
