package com.pivotdeck.bucket;

import java.util.Objects;

/**
 * A half-open interval {@code [lower, upper)} with a label.
 *
 * <p>Open bounds are expressed with {@link Double#NEGATIVE_INFINITY} and
 * {@link Double#POSITIVE_INFINITY}.
 */
public record NumericRange(double lower, double upper, String label) {

    public NumericRange {
        Objects.requireNonNull(label, "label must not be null");
    }

    public static NumericRange of(double lower, double upper, String label) {
        return new NumericRange(lower, upper, label);
    }

    /** Range {@code [lower, +inf)}. */
    public static NumericRange atLeast(double lower, String label) {
        return new NumericRange(lower, Double.POSITIVE_INFINITY, label);
    }

    /** Range {@code (-inf, upper)}. */
    public static NumericRange below(double upper, String label) {
        return new NumericRange(Double.NEGATIVE_INFINITY, upper, label);
    }

    /**
     * Tests {@code lower <= value < upper}.
     *
     * @param value the value
     * @return true if the value falls in this range
     */
    public boolean contains(double value) {
        return lower <= value && value < upper;
    }

    @Override
    public String toString() {
        return "[" + lower + ", " + upper + ") -> " + label;
    }
}
