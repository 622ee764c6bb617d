package com.pivotdeck.pivot;

import com.pivotdeck.bucket.BucketRule;
import com.pivotdeck.bucket.BucketRules;
import com.pivotdeck.catalog.DimensionCatalog;
import com.pivotdeck.data.Dataset;
import com.pivotdeck.data.Record;
import com.pivotdeck.exception.ConfigurationException;
import com.pivotdeck.exception.TypeMismatchException;
import com.pivotdeck.filter.Filter;
import com.pivotdeck.types.DataType;
import com.pivotdeck.types.NumericType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Distribution of one numeric field within each bucket of one dimension.
 *
 * <p>For every label of the dimension (in bucket definition order) the insights report
 * the number of records and, over the records where the field is present, the mean,
 * median, sample standard deviation and the 25th and 75th percentiles. Percentiles use
 * linear interpolation between the closest ranks.
 */
public final class SegmentInsights {

    /**
     * Statistics of one bucket.
     *
     * @param size records in the bucket
     * @param mean mean of present values, null if none
     * @param median median of present values, null if none
     * @param standardDeviation sample standard deviation, null with fewer than two values
     * @param p25 25th percentile, null if none
     * @param p75 75th percentile, null if none
     */
    public record Summary(int size, Double mean, Double median, Double standardDeviation, Double p25, Double p75) {
    }

    private final String dimension;
    private final String field;
    private final Map<String, Summary> byLabel;

    private SegmentInsights(String dimension, String field, Map<String, Summary> byLabel) {
        this.dimension = dimension;
        this.field = field;
        this.byLabel = Collections.unmodifiableMap(byLabel);
    }

    /**
     * Computes per-bucket statistics.
     *
     * @param dataset the dataset
     * @param rule the bucket rule for the dimension, or null to group by raw value
     * @param filter the audience filter
     * @param dimension the grouping dimension
     * @param field the numeric field to describe
     * @return the insights
     * @throws TypeMismatchException if the field is not numeric
     */
    public static SegmentInsights analyze(Dataset dataset, BucketRule rule, Filter filter,
                                          String dimension, String field) {
        Objects.requireNonNull(dataset, "dataset must not be null");
        Objects.requireNonNull(filter, "filter must not be null");
        DimensionCatalog catalog = DimensionCatalog.fromSchema(dataset.schema());
        DataType dimensionType = catalog.describe(dimension).type();
        DataType fieldType = catalog.describe(field).type();
        if (!(fieldType instanceof NumericType)) {
            throw new TypeMismatchException("Insights need a numeric field, '" + field + "' is "
                + fieldType.typeName(), field, NumericType.get(), null);
        }
        Map<String, BucketRule> rules = new HashMap<>();
        if (rule != null) {
            if (!rule.dimension().equals(dimension)) {
                throw new ConfigurationException(
                    "Bucket rule targets '" + rule.dimension() + "'", dimension);
            }
            BucketRules.validateFor(rule, catalog);
            rules.put(dimension, rule);
        }
        AxisLabeler labeler = new AxisLabeler(List.of(dimension), rules, Map.of(dimension, dimensionType));

        Map<LabelTuple, List<Record>> groups = new HashMap<>();
        for (Record record : filter.select(dataset.records())) {
            groups.computeIfAbsent(labeler.label(record), t -> new ArrayList<>()).add(record);
        }

        Map<String, Summary> byLabel = new LinkedHashMap<>();
        for (LabelTuple label : labeler.axis(groups.keySet(), false)) {
            byLabel.put(label.get(0), summarize(groups.get(label), field));
        }
        return new SegmentInsights(dimension, field, byLabel);
    }

    public String dimension() {
        return dimension;
    }

    public String field() {
        return field;
    }

    /**
     * Returns the statistics per bucket label, in display order.
     */
    public Map<String, Summary> byLabel() {
        return byLabel;
    }

    // ==================== Statistics ====================

    static Summary summarize(List<Record> group, String field) {
        List<Double> values = new ArrayList<>(group.size());
        for (Record record : group) {
            if (record.get(field) instanceof Double d) {
                values.add(d);
            }
        }
        if (values.isEmpty()) {
            return new Summary(group.size(), null, null, null, null, null);
        }
        Collections.sort(values);
        double mean = 0.0;
        for (double v : values) {
            mean += v;
        }
        mean /= values.size();
        Double stdDev = null;
        if (values.size() > 1) {
            double squares = 0.0;
            for (double v : values) {
                squares += (v - mean) * (v - mean);
            }
            stdDev = Math.sqrt(squares / (values.size() - 1));
        }
        return new Summary(group.size(), mean, percentile(values, 0.5), stdDev,
            percentile(values, 0.25), percentile(values, 0.75));
    }

    static double percentile(List<Double> sorted, double fraction) {
        double rank = fraction * (sorted.size() - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        double weight = rank - lower;
        return sorted.get(lower) + (sorted.get(upper) - sorted.get(lower)) * weight;
    }
}
