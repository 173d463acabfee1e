package com.anthem.billtriage.rules;

import java.math.BigDecimal;

/**
 * Bounds of the {@code assigned_rate} columns. Values outside them would be rounded or rejected
 * on insert, so the rate rules refuse them up front.
 */
final class RateLimits {

    /** {@code rate NUMERIC(12,2)}. */
    static final int MAX_SCALE = 2;
    static final int MAX_INTEGER_DIGITS = 10;

    /** {@code procedure_code VARCHAR(20)}. */
    static final int MAX_CODE_LENGTH = 20;

    /** {@code modifier VARCHAR(10)}. */
    static final int MAX_MODIFIER_LENGTH = 10;

    /** {@code category VARCHAR(100)}. */
    static final int MAX_CATEGORY_LENGTH = 100;

    static final String RATE_RULE = "Rate must be greater than zero with at most "
            + MAX_SCALE + " decimal places and " + MAX_INTEGER_DIGITS + " integer digits";

    private RateLimits() {
    }

    /**
     * True when the rate is above zero and stores unchanged in {@code NUMERIC(12,2)}.
     * Trailing zeros are ignored, so {@code 150.000} is accepted.
     */
    static boolean isStorableRate(BigDecimal rate) {
        if (rate == null || rate.signum() <= 0) {
            return false;
        }
        BigDecimal stripped = rate.stripTrailingZeros();
        return stripped.scale() <= MAX_SCALE
                && stripped.precision() - stripped.scale() <= MAX_INTEGER_DIGITS;
    }

    static boolean exceeds(String value, int maxLength) {
        return value != null && value.trim().length() > maxLength;
    }
}
