package com.github.dimitryivaniuta.tutoring.error;

/**
 * Publishing to the settlement channel failed.
 *
 * <p>Raised after the payment row was committed, which therefore stays {@code Pending}.</p>
 */
public class TransportException extends TutoringException {

    public TransportException(String message, Throwable cause) {
        super(500, "TRANSPORT_ERROR", message, cause);
    }
}
