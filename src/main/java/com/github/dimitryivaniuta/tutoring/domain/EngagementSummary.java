package com.github.dimitryivaniuta.tutoring.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Engagement of a student as listed by the engagements-by-student query.
 *
 * @param engagementId    engagement id
 * @param tutorName       tutor name
 * @param subjectName     subject name
 * @param contractedHours contracted hours
 * @param status          engagement status
 */
public record EngagementSummary(
        @JsonProperty("id_conexao") long engagementId,
        @JsonProperty("professor") String tutorName,
        @JsonProperty("nome_materia") String subjectName,
        @JsonProperty("horas_contratadas") int contractedHours,
        @JsonProperty("status") String status
) {}
