package com.navtracker.common;

import java.math.BigDecimal;

/**
 * Coerces loosely typed upstream amounts into finite, non-negative BigDecimal values.
 * null, NaN, infinities and unparsable strings become zero; negatives are floored to zero.
 */
public final class UsdAmounts {

    private UsdAmounts() {
    }

    public static BigDecimal sanitize(BigDecimal value) {
        if (value == null || value.signum() < 0) {
            return BigDecimal.ZERO;
        }
        return value;
    }

    public static BigDecimal sanitize(Double value) {
        if (value == null || value.isNaN() || value.isInfinite()) {
            return BigDecimal.ZERO;
        }
        return sanitize(BigDecimal.valueOf(value));
    }

    public static BigDecimal sanitize(String value) {
        if (value == null || value.isBlank()) {
            return BigDecimal.ZERO;
        }
        try {
            return sanitize(new BigDecimal(value.strip()));
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO;
        }
    }

    /**
     * Dispatches on the runtime type; anything that is not a number or numeric string yields zero.
     */
    public static BigDecimal sanitize(Object value) {
        if (value instanceof BigDecimal decimal) {
            return sanitize(decimal);
        }
        if (value instanceof Double || value instanceof Float) {
            return sanitize(((Number) value).doubleValue());
        }
        if (value instanceof Number number) {
            return sanitize(new BigDecimal(number.toString()));
        }
        if (value instanceof CharSequence text) {
            return sanitize(text.toString());
        }
        return BigDecimal.ZERO;
    }

    /**
     * Null-safe amount × price; both factors are sanitized first.
     */
    public static BigDecimal value(BigDecimal amount, BigDecimal price) {
        return sanitize(amount).multiply(sanitize(price));
    }
}
