package com.github.dimitryivaniuta.tutoring.handler.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Request payload for creating a student/tutor engagement.
 *
 * <p>Ids and hours accept JSON numbers as well as numeric strings.</p>
 */
public record CreateEngagementRequest(
        @JsonProperty("id_professor")
        @NotNull(message = "Field 'id_professor' is required.")
        @Positive(message = "Field 'id_professor' must be a positive integer.")
        Long tutorId,

        @JsonProperty("id_aluno")
        @NotNull(message = "Field 'id_aluno' is required.")
        @Positive(message = "Field 'id_aluno' must be a positive integer.")
        Long studentId,

        @JsonProperty("id_materia")
        @NotNull(message = "Field 'id_materia' is required.")
        @Positive(message = "Field 'id_materia' must be a positive integer.")
        Long subjectId,

        @JsonProperty("horas_contratadas")
        @NotNull(message = "Field 'horas_contratadas' is required.")
        @Positive(message = "Field 'horas_contratadas' must be a positive integer.")
        Integer contractedHours
) {}
