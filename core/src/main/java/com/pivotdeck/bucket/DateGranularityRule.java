package com.pivotdeck.bucket;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Buckets a date dimension by truncating each date to a calendar unit.
 *
 * <p>Labels are ordered chronologically, with {@link BucketLabels#MISSING} last.
 */
public final class DateGranularityRule implements BucketRule {

    private final String dimension;
    private final DateGranularity granularity;

    public DateGranularityRule(String dimension, DateGranularity granularity) {
        this.dimension = Objects.requireNonNull(dimension, "dimension must not be null");
        this.granularity = Objects.requireNonNull(granularity, "granularity must not be null");
    }

    @Override
    public String dimension() {
        return dimension;
    }

    @Override
    public BucketKind kind() {
        return BucketKind.DATE_GRANULARITY;
    }

    public DateGranularity granularity() {
        return granularity;
    }

    @Override
    public String apply(Object value) {
        if (value instanceof LocalDate date) {
            return granularity.label(date);
        }
        return BucketLabels.MISSING;
    }

    @Override
    public List<String> declaredLabels() {
        return List.of();
    }

    @Override
    public Comparator<String> labelOrder() {
        return Comparator.comparing((String label) -> BucketLabels.isReserved(label))
            .thenComparing(Comparator.naturalOrder());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DateGranularityRule)) return false;
        DateGranularityRule that = (DateGranularityRule) o;
        return dimension.equals(that.dimension) && granularity == that.granularity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(dimension, granularity);
    }

    @Override
    public String toString() {
        return "DateGranularityRule[" + dimension + ", " + granularity + "]";
    }
}
