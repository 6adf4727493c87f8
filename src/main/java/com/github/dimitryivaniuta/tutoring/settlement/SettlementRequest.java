package com.github.dimitryivaniuta.tutoring.settlement;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.dimitryivaniuta.tutoring.domain.PaymentStatus;

/**
 * Message placed on the settlement channel after a payment was recorded.
 *
 * <p>Only {@code id_pagamento} is needed to settle; the other fields describe the payment for consumers
 * and for the decision.</p>
 *
 * @param paymentId     payment id
 * @param engagementId  engagement the payment belongs to
 * @param amount        amount as a JSON number
 * @param paymentMethod payment method, e.g. {@code pix}
 * @param status        status at publish time, always {@code Pending}
 */
public record SettlementRequest(
        @JsonProperty("id_pagamento") Long paymentId,
        @JsonProperty("id_conexao") Long engagementId,
        @JsonProperty("valor") Double amount,
        @JsonProperty("forma_pagamento") String paymentMethod,
        @JsonProperty("status_pagamento") String status
) {

    public static SettlementRequest pending(long paymentId, long engagementId, double amount, String paymentMethod) {
        return new SettlementRequest(paymentId, engagementId, amount, paymentMethod, PaymentStatus.PENDING.label());
    }
}
