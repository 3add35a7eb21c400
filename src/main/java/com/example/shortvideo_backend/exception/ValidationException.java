package com.example.shortvideo_backend.exception;

/**
 * Thrown synchronously by submission when the scenes or options are unusable. A job rejected this
 * way never enters the queue.
 */
public class ValidationException extends RuntimeException {
    public ValidationException(String message) {
        super(message);
    }
}
