package com.github.dimitryivaniuta.tutoring.domain;

/**
 * Payment status as stored in {@code Pagamentos.status_pagamento}.
 *
 * <p>A payment is created {@link #PENDING} and settled exactly once into {@link #PAID} or {@link #CANCELLED}.</p>
 */
public enum PaymentStatus {
    /** Created, waiting for settlement. */
    PENDING("Pending"),

    /** Settled successfully. */
    PAID("Paid"),

    /** Rejected by the payment processor. */
    CANCELLED("Cancelled");

    private final String label;

    PaymentStatus(String label) {
        this.label = label;
    }

    /**
     * Value stored in the database and carried on the wire.
     *
     * @return label
     */
    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }
}
