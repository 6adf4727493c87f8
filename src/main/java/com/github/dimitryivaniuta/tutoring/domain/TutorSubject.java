package com.github.dimitryivaniuta.tutoring.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One tutor/subject pair returned by the tutor search.
 *
 * @param tutorId     tutor id
 * @param name        tutor name
 * @param hourlyRate  hourly rate
 * @param subjectName subject the tutor teaches
 */
public record TutorSubject(
        @JsonProperty("id_professor") long tutorId,
        @JsonProperty("nome") String name,
        @JsonProperty("valor_hora") double hourlyRate,
        @JsonProperty("nome_materia") String subjectName
) {}
