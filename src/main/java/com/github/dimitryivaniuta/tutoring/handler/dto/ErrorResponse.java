package com.github.dimitryivaniuta.tutoring.handler.dto;

import java.time.Instant;

/**
 * Generic error response.
 *
 * @param code machine-readable code
 * @param error human readable message
 * @param timestamp event time
 */
public record ErrorResponse(String code, String error, Instant timestamp) {}
