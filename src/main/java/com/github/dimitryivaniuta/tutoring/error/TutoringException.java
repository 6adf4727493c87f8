package com.github.dimitryivaniuta.tutoring.error;

/**
 * Base type of all failures a handler converts into the response envelope.
 *
 * <p>Each subtype fixes the HTTP status and the machine-readable code reported to the caller.</p>
 */
public abstract class TutoringException extends RuntimeException {

    private final int httpStatus;
    private final String code;

    protected TutoringException(int httpStatus, String code, String message, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
        this.code = code;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }
}
