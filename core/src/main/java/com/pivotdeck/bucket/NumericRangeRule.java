package com.pivotdeck.bucket;

import com.pivotdeck.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Buckets a numeric dimension into declared half-open ranges.
 *
 * <p>Ranges are checked in declared order and a value takes the label of the first
 * range with {@code lower <= value < upper}. A value equal to a boundary therefore
 * belongs to the range that starts there. Values outside every range (gaps, or
 * beyond the outer bounds) are labelled {@link BucketLabels#UNSPECIFIED}.
 *
 * <p>Example:
 * <pre>
 *   [18, 25) -> "18-24"
 *   [25, 35) -> "25-34"
 *
 *   18 -> "18-24", 25 -> "25-34", 40 -> "Unspecified", null -> "Missing"
 * </pre>
 */
public final class NumericRangeRule implements BucketRule {

    private final String dimension;
    private final List<NumericRange> ranges;
    private final List<String> labels;

    /**
     * Creates a numeric range rule.
     *
     * @param dimension the dimension to bucket
     * @param ranges the ranges in ascending order
     * @throws ConfigurationException if ranges are empty, inverted, overlapping, out of
     *         order, or use a duplicate or reserved label
     */
    public NumericRangeRule(String dimension, List<NumericRange> ranges) {
        this.dimension = Objects.requireNonNull(dimension, "dimension must not be null");
        Objects.requireNonNull(ranges, "ranges must not be null");
        validate(dimension, ranges);
        this.ranges = Collections.unmodifiableList(new ArrayList<>(ranges));
        List<String> names = new ArrayList<>(ranges.size());
        for (NumericRange range : ranges) {
            names.add(range.label());
        }
        this.labels = Collections.unmodifiableList(names);
    }

    private static void validate(String dimension, List<NumericRange> ranges) {
        if (ranges.isEmpty()) {
            throw new ConfigurationException("Numeric range rule needs at least one range", dimension);
        }

        Set<String> seen = new HashSet<>();
        NumericRange previous = null;
        for (NumericRange range : ranges) {
            if (Double.isNaN(range.lower()) || Double.isNaN(range.upper())) {
                throw new ConfigurationException("Range bounds must be numbers: " + range, dimension);
            }
            if (range.lower() >= range.upper()) {
                throw new ConfigurationException("Range lower bound must be below its upper bound: " + range, dimension);
            }
            if (range.label().isBlank()) {
                throw new ConfigurationException("Range label must not be blank: " + range, dimension);
            }
            if (BucketLabels.isReserved(range.label())) {
                throw new ConfigurationException("Range label '" + range.label() + "' is reserved", dimension);
            }
            if (!seen.add(range.label())) {
                throw new ConfigurationException("Duplicate range label '" + range.label() + "'", dimension);
            }
            if (previous != null && range.lower() < previous.upper()) {
                throw new ConfigurationException(
                    "Ranges must be ascending and non-overlapping: " + previous + " then " + range, dimension);
            }
            previous = range;
        }
    }

    @Override
    public String dimension() {
        return dimension;
    }

    @Override
    public BucketKind kind() {
        return BucketKind.NUMERIC_RANGE;
    }

    /**
     * Returns the ranges in declared order.
     *
     * @return an unmodifiable list of ranges
     */
    public List<NumericRange> ranges() {
        return ranges;
    }

    @Override
    public String apply(Object value) {
        if (value == null) {
            return BucketLabels.MISSING;
        }
        if (!(value instanceof Number number)) {
            return BucketLabels.UNSPECIFIED;
        }
        double d = number.doubleValue();
        for (NumericRange range : ranges) {
            if (range.contains(d)) {
                return range.label();
            }
        }
        return BucketLabels.UNSPECIFIED;
    }

    @Override
    public List<String> declaredLabels() {
        return labels;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NumericRangeRule)) return false;
        NumericRangeRule that = (NumericRangeRule) o;
        return dimension.equals(that.dimension) && ranges.equals(that.ranges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dimension, ranges);
    }

    @Override
    public String toString() {
        return "NumericRangeRule[" + dimension + ", " + ranges + "]";
    }
}
