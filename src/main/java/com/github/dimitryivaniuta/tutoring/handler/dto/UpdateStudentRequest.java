package com.github.dimitryivaniuta.tutoring.handler.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Request payload for updating a student, keyed by national id. Only supplied fields are updated.
 */
public record UpdateStudentRequest(
        @JsonProperty("cpf") @NotBlank(message = "Field 'cpf' is required for an update.") String nationalId,
        @JsonProperty("nome") String name
) {}
