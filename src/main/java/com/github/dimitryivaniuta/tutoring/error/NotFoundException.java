package com.github.dimitryivaniuta.tutoring.error;

/**
 * Referenced entity does not exist.
 */
public class NotFoundException extends TutoringException {

    public NotFoundException(String message) {
        super(404, "NOT_FOUND", message, null);
    }
}
