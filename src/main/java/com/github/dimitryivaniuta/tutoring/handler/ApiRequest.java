package com.github.dimitryivaniuta.tutoring.handler;

import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Inbound request as seen by a handler, independent of the transport that delivered it.
 *
 * @param httpMethod            HTTP method; only used to recognise {@code OPTIONS}
 * @param queryStringParameters query parameters (read operations); entries with a null value are dropped
 * @param body                  raw JSON body (write operations), may be null
 */
public record ApiRequest(String httpMethod, Map<String, String> queryStringParameters, String body) {

    public ApiRequest {
        queryStringParameters = queryStringParameters == null ? Map.of() : queryStringParameters.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getValue() != null)
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
    }

    public static ApiRequest get(Map<String, String> queryStringParameters) {
        return new ApiRequest("GET", queryStringParameters, null);
    }

    public static ApiRequest withBody(String httpMethod, String body) {
        return new ApiRequest(httpMethod, Map.of(), body);
    }

    public boolean isPreflight() {
        return "OPTIONS".equalsIgnoreCase(httpMethod);
    }

    /**
     * Returns a query parameter, treating blank values as absent.
     *
     * @param name parameter name
     * @return trimmed value
     */
    public Optional<String> queryParameter(String name) {
        return Optional.ofNullable(queryStringParameters.get(name))
                .map(String::trim)
                .filter(v -> !v.isEmpty());
    }
}
