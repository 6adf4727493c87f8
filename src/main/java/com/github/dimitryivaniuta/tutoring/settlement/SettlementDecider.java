package com.github.dimitryivaniuta.tutoring.settlement;

import com.github.dimitryivaniuta.tutoring.domain.PaymentStatus;

/**
 * Decides how a pending payment settles.
 */
public interface SettlementDecider {

    /**
     * Decides the outcome for one request.
     *
     * @param request settlement request
     * @return {@link PaymentStatus#PAID} or {@link PaymentStatus#CANCELLED}
     */
    PaymentStatus decide(SettlementRequest request);
}
