package com.cloudimages.controller;

import com.cloudimages.exception.CloudImagesException;
import com.cloudimages.exception.ConflictException;
import com.cloudimages.exception.DecryptionException;
import com.cloudimages.exception.NotFoundException;
import com.cloudimages.exception.ProviderConnectionException;
import com.cloudimages.exception.UnsupportedFormatException;
import com.cloudimages.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.Map;

/**
 * Maps exceptions to {"error": code, "message": text} bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(CloudImagesException.class)
    public ResponseEntity<Map<String, String>> handleDomain(CloudImagesException e) {
        HttpStatus status = statusFor(e);
        if (status.is5xxServerError()) {
            log.error("Request failed with {}: {}", e.getErrorCode(), e.getMessage(), e);
        } else {
            log.debug("Request rejected with {}: {}", e.getErrorCode(), e.getMessage());
        }
        return body(status, e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler({ MissingRequestHeaderException.class, MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class, MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class })
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception e) {
        return body(HttpStatus.BAD_REQUEST, "validation_error", e.getMessage());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, String>> handleTooLarge(MaxUploadSizeExceededException e) {
        return body(HttpStatus.PAYLOAD_TOO_LARGE, "validation_error", "Uploaded file exceeds the size limit");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleUnexpected(Exception e) {
        if (e instanceof ErrorResponse) {
            // Spring MVC's own failures (405, 406, 415 ...) keep their status
            HttpStatusCode status = ((ErrorResponse) e).getStatusCode();
            return body(status, "request_error", e.getMessage());
        }
        log.error("Unexpected error", e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "An unexpected error occurred");
    }

    static HttpStatus statusFor(CloudImagesException e) {
        if (e instanceof ValidationException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (e instanceof NotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (e instanceof ConflictException) {
            return HttpStatus.CONFLICT;
        }
        if (e instanceof DecryptionException) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        if (e instanceof ProviderConnectionException) {
            return HttpStatus.BAD_GATEWAY;
        }
        if (e instanceof UnsupportedFormatException) {
            return HttpStatus.UNSUPPORTED_MEDIA_TYPE;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static ResponseEntity<Map<String, String>> body(HttpStatusCode status, String code, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "error", code,
                "message", message != null ? message : "Request failed with status " + status.value()));
    }
}
