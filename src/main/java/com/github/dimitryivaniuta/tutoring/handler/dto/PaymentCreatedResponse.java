package com.github.dimitryivaniuta.tutoring.handler.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response returned after a payment was recorded and queued for settlement.
 */
public record PaymentCreatedResponse(
        String message,
        @JsonProperty("id_pagamento") long paymentId
) {}
