package com.github.dimitryivaniuta.tutoring.handler;

import java.util.Map;

/**
 * Uniform response envelope returned by every handler.
 *
 * @param statusCode HTTP status code
 * @param headers    response headers (CORS and content type)
 * @param body       JSON-encoded body
 */
public record ApiResponse(int statusCode, Map<String, String> headers, String body) {

    public ApiResponse {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }
}
