package com.pivotdeck.metric;

import com.pivotdeck.exception.ConfigurationException;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Definition of one metric column of a pivot.
 *
 * <p>For {@code SUM}, {@code MEAN} and {@code DISTINCT_COUNT} the single source is a
 * dimension name. For {@code RATIO} the two sources are the names of other metrics:
 * numerator first, then denominator.
 *
 * @param name the output name
 * @param kind the aggregation kind
 * @param sourceFields the source dimension or metric names
 */
public record MetricDef(String name, MetricKind kind, List<String> sourceFields) {

    public MetricDef {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(sourceFields, "sourceFields must not be null");
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Metric name must not be blank", name);
        }
        if (sourceFields.size() != kind.arity()) {
            throw new ConfigurationException(
                kind + " takes " + kind.arity() + " source field(s), got " + sourceFields, name);
        }
        for (String field : sourceFields) {
            if (field == null || field.isBlank()) {
                throw new ConfigurationException("Source field names must not be blank", name);
            }
        }
        sourceFields = List.copyOf(sourceFields);
    }

    // ==================== Factory Methods ====================

    public static MetricDef count(String name) {
        return new MetricDef(name, MetricKind.COUNT, List.of());
    }

    public static MetricDef sum(String name, String field) {
        return new MetricDef(name, MetricKind.SUM, List.of(field));
    }

    public static MetricDef mean(String name, String field) {
        return new MetricDef(name, MetricKind.MEAN, List.of(field));
    }

    public static MetricDef distinctCount(String name, String field) {
        return new MetricDef(name, MetricKind.DISTINCT_COUNT, List.of(field));
    }

    public static MetricDef ratio(String name, String numeratorMetric, String denominatorMetric) {
        return new MetricDef(name, MetricKind.RATIO, List.of(numeratorMetric, denominatorMetric));
    }

    public boolean isRatio() {
        return kind == MetricKind.RATIO;
    }

    @Override
    public String toString() {
        return name + "=" + kind.name().toLowerCase(Locale.ROOT) + sourceFields;
    }
}
