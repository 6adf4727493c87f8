package com.github.dimitryivaniuta.tutoring.handler.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;

/**
 * Request payload for recording a payment against an engagement.
 */
public record CreatePaymentRequest(
        @JsonProperty("id_conexao")
        @NotNull(message = "Field 'id_conexao' is required.")
        @Positive(message = "Field 'id_conexao' must be a positive integer.")
        Long engagementId,

        @JsonProperty("valor")
        @NotNull(message = "Field 'valor' is required.")
        @Positive(message = "Field 'valor' must be positive.")
        BigDecimal amount,

        @JsonProperty("forma_pagamento")
        @NotBlank(message = "Field 'forma_pagamento' is required.")
        String paymentMethod
) {}
