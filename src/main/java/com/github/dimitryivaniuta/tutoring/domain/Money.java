package com.github.dimitryivaniuta.tutoring.domain;

import java.math.BigDecimal;

/**
 * Conversions for monetary columns.
 *
 * <p>Amounts are {@code DECIMAL} in the database and {@link BigDecimal} in JDBC, but every JSON document this
 * service emits carries them as plain floating-point numbers.</p>
 */
public final class Money {

    private Money() {
    }

    /**
     * Converts a decimal column value to a JSON-friendly double.
     *
     * @param value decimal value, may be null
     * @return double value, {@code 0.0} for null
     */
    public static double toDouble(BigDecimal value) {
        return value == null ? 0.0d : value.doubleValue();
    }
}
