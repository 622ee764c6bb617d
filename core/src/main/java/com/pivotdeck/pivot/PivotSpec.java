package com.pivotdeck.pivot;

import com.pivotdeck.exception.ComputationException;
import com.pivotdeck.exception.ConfigurationException;
import com.pivotdeck.metric.MetricDef;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Shape of a pivot: which dimensions go on rows and columns, which metrics fill the
 * cells, and whether empty combinations are shown.
 *
 * <p>Built through {@link #builder()}, which rejects structurally invalid specs.
 * Dimension names and metric fields are checked against the dataset later, by the
 * aggregator, before any record is read.
 */
public final class PivotSpec {

    private final List<String> rowDimensions;
    private final List<String> columnDimensions;
    private final List<MetricDef> metrics;
    private final boolean showEmpty;

    private PivotSpec(Builder builder) {
        this.rowDimensions = List.copyOf(builder.rowDimensions);
        this.columnDimensions = List.copyOf(builder.columnDimensions);
        this.metrics = List.copyOf(builder.metrics);
        this.showEmpty = builder.showEmpty;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> rowDimensions() {
        return rowDimensions;
    }

    public List<String> columnDimensions() {
        return columnDimensions;
    }

    public List<MetricDef> metrics() {
        return metrics;
    }

    public boolean showEmpty() {
        return showEmpty;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PivotSpec)) return false;
        PivotSpec that = (PivotSpec) o;
        return showEmpty == that.showEmpty &&
               rowDimensions.equals(that.rowDimensions) &&
               columnDimensions.equals(that.columnDimensions) &&
               metrics.equals(that.metrics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rowDimensions, columnDimensions, metrics, showEmpty);
    }

    @Override
    public String toString() {
        return String.format("PivotSpec[rows=%s, columns=%s, metrics=%s, showEmpty=%s]",
            rowDimensions, columnDimensions, metrics, showEmpty);
    }

    /**
     * Builder for {@link PivotSpec}.
     */
    public static final class Builder {
        private final List<String> rowDimensions = new ArrayList<>();
        private final List<String> columnDimensions = new ArrayList<>();
        private final List<MetricDef> metrics = new ArrayList<>();
        private boolean showEmpty;

        private Builder() {}

        public Builder rows(String... dimensions) {
            return rows(List.of(dimensions));
        }

        public Builder rows(List<String> dimensions) {
            rowDimensions.addAll(dimensions);
            return this;
        }

        public Builder columns(String... dimensions) {
            return columns(List.of(dimensions));
        }

        public Builder columns(List<String> dimensions) {
            columnDimensions.addAll(dimensions);
            return this;
        }

        public Builder metric(MetricDef metric) {
            metrics.add(Objects.requireNonNull(metric, "metric must not be null"));
            return this;
        }

        public Builder metrics(List<MetricDef> defs) {
            defs.forEach(this::metric);
            return this;
        }

        public Builder showEmpty(boolean value) {
            this.showEmpty = value;
            return this;
        }

        /**
         * Builds the spec.
         *
         * @return the spec
         * @throws ComputationException if no metric is requested
         * @throws ConfigurationException if a dimension repeats within or across axes
         */
        public PivotSpec build() {
            if (metrics.isEmpty()) {
                throw new ComputationException("At least one metric is required", null);
            }
            Set<String> seen = new HashSet<>();
            for (String dimension : rowDimensions) {
                if (!seen.add(Objects.requireNonNull(dimension, "dimension must not be null"))) {
                    throw new ConfigurationException("Dimension appears more than once in the pivot", dimension);
                }
            }
            for (String dimension : columnDimensions) {
                if (!seen.add(Objects.requireNonNull(dimension, "dimension must not be null"))) {
                    throw new ConfigurationException("Dimension appears more than once in the pivot", dimension);
                }
            }
            return new PivotSpec(this);
        }
    }
}
