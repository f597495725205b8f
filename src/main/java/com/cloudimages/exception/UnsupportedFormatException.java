package com.cloudimages.exception;

/**
 * Thrown when uploaded bytes cannot be decoded as an image.
 */
public class UnsupportedFormatException extends CloudImagesException {

    public UnsupportedFormatException(String message) {
        super("unsupported_format", message);
    }

    public UnsupportedFormatException(String message, Throwable cause) {
        super("unsupported_format", message, cause);
    }
}
