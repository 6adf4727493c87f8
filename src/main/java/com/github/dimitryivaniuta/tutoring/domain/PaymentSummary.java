package com.github.dimitryivaniuta.tutoring.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payment of a student as listed by the payments-by-student query.
 *
 * @param paymentId     payment id
 * @param engagementId  engagement the payment belongs to
 * @param amount        amount
 * @param paymentMethod free-text payment method
 * @param status        stored status label
 */
public record PaymentSummary(
        @JsonProperty("id_pagamento") long paymentId,
        @JsonProperty("id_conexao") long engagementId,
        @JsonProperty("valor") double amount,
        @JsonProperty("forma_pagamento") String paymentMethod,
        @JsonProperty("status_pagamento") String status
) {}
