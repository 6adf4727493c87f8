package com.github.dimitryivaniuta.tutoring.handler.dto;

/**
 * Body carrying only a human-readable message.
 *
 * @param message message
 */
public record MessageResponse(String message) {}
