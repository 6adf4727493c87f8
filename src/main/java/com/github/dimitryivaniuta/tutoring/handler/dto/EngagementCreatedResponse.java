package com.github.dimitryivaniuta.tutoring.handler.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response returned after an engagement was created.
 */
public record EngagementCreatedResponse(
        String message,
        @JsonProperty("id_conexao") long engagementId
) {}
