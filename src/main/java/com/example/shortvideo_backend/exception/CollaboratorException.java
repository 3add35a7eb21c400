package com.example.shortvideo_backend.exception;

/**
 * An external media service call failed, after retries where the call is retried.
 */
public class CollaboratorException extends RuntimeException {
    private final String operation;

    public CollaboratorException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
