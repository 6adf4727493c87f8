package com.github.dimitryivaniuta.tutoring.error;

/**
 * A database statement or connection failed (constraint violation, unreachable proxy, timeout).
 *
 * <p>The message is returned to the caller for diagnostics.</p>
 */
public class StorageException extends TutoringException {

    public StorageException(String message, Throwable cause) {
        super(500, "STORAGE_ERROR", message, cause);
    }
}
