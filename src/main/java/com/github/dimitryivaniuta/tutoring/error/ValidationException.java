package com.github.dimitryivaniuta.tutoring.error;

/**
 * Caller-supplied input is missing or malformed. Never retried.
 */
public class ValidationException extends TutoringException {

    public ValidationException(String message) {
        this(message, null);
    }

    public ValidationException(String message, Throwable cause) {
        super(400, "VALIDATION_ERROR", message, cause);
    }
}
