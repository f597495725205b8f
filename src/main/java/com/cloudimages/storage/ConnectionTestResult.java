package com.cloudimages.storage;

/**
 * Informational outcome of a connection test. Never persisted.
 */
public class ConnectionTestResult {

    public enum Status {
        SUCCESS, ERROR
    }

    private final Status status;
    private final String message;

    private ConnectionTestResult(Status status, String message) {
        this.status = status;
        this.message = message;
    }

    public static ConnectionTestResult success(String message) {
        return new ConnectionTestResult(Status.SUCCESS, message);
    }

    public static ConnectionTestResult error(String message) {
        return new ConnectionTestResult(Status.ERROR, message);
    }

    public Status getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    @Override
    public String toString() {
        return status + ": " + message;
    }
}
