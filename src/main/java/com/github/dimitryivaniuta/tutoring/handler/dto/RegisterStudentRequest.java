package com.github.dimitryivaniuta.tutoring.handler.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Request payload for registering a student.
 */
public record RegisterStudentRequest(
        @JsonProperty("nome") @NotBlank(message = "Field 'nome' is required.") String name,
        @JsonProperty("cpf") @NotBlank(message = "Field 'cpf' is required.") String nationalId
) {}
