package com.github.dimitryivaniuta.tutoring.handler;

import com.github.dimitryivaniuta.tutoring.error.ValidationException;

/**
 * Coercion of query parameters.
 */
final class RequestParameters {

    private RequestParameters() {
    }

    /**
     * Reads a required query parameter that must be a positive integer.
     *
     * @param request request
     * @param name    parameter name
     * @return parsed value
     * @throws ValidationException if absent, non-numeric or not positive
     */
    static long requirePositiveLong(ApiRequest request, String name) {
        String raw = request.queryParameter(name)
                .orElseThrow(() -> new ValidationException("Query parameter '" + name + "' is required."));
        long value;
        try {
            value = Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new ValidationException("Query parameter '" + name + "' must be an integer.", e);
        }
        if (value <= 0) {
            throw new ValidationException("Query parameter '" + name + "' must be positive.");
        }
        return value;
    }
}
