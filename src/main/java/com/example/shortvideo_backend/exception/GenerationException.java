package com.example.shortvideo_backend.exception;

/**
 * Every visual acquisition path for a scene was exhausted.
 */
public class GenerationException extends RuntimeException {
    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
