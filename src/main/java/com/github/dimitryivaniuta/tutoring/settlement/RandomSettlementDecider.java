package com.github.dimitryivaniuta.tutoring.settlement;

import com.github.dimitryivaniuta.tutoring.domain.PaymentStatus;
import java.util.function.DoubleSupplier;

/**
 * Stand-in for a payment provider: settles as paid with a fixed probability.
 *
 * <p>The random source is injected so tests can force either outcome.</p>
 */
public class RandomSettlementDecider implements SettlementDecider {

    private final DoubleSupplier random;
    private final double paidProbability;

    /**
     * @param random          source of values in {@code [0, 1)}
     * @param paidProbability probability of {@link PaymentStatus#PAID}, in {@code [0, 1]}
     */
    public RandomSettlementDecider(DoubleSupplier random, double paidProbability) {
        if (paidProbability < 0.0 || paidProbability > 1.0) {
            throw new IllegalArgumentException("paidProbability must be within [0, 1], was " + paidProbability);
        }
        this.random = random;
        this.paidProbability = paidProbability;
    }

    @Override
    public PaymentStatus decide(SettlementRequest request) {
        return random.getAsDouble() < paidProbability ? PaymentStatus.PAID : PaymentStatus.CANCELLED;
    }
}
