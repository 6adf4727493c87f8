package com.github.dimitryivaniuta.tutoring.domain;

/**
 * Engagement status as stored in {@code Conexoes_Aluno_Prof.status}.
 */
public enum EngagementStatus {
    /** Default for newly created engagements. */
    ACTIVE("Active");

    private final String label;

    EngagementStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
