package com.pivotdeck.pivot;

import com.pivotdeck.bucket.BucketRule;
import com.pivotdeck.data.Dataset;
import com.pivotdeck.filter.Filter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Side-by-side comparison of one pivot computed for two audiences.
 *
 * <p>The baseline and the segment are computed with the same dataset, bucket rules
 * and spec but different filters. Rows and columns are the union of both results,
 * in bucket definition order. For every cell present in either result, each metric
 * is reported as a {@link Difference}.
 */
public final class SegmentComparison {

    private static final Logger logger = LoggerFactory.getLogger(SegmentComparison.class);

    /**
     * One metric of one cell in both audiences.
     *
     * @param baseline the baseline value (null if undefined or the cell is absent)
     * @param segment the segment value (null if undefined or the cell is absent)
     * @param absolute segment minus baseline, null unless both are present
     * @param percent absolute difference as a percentage of the baseline, null unless both are
     *                present and the baseline is non-zero
     */
    public record Difference(Number baseline, Number segment, Double absolute, Double percent) {

        static Difference of(Number baseline, Number segment) {
            if (baseline == null || segment == null) {
                return new Difference(baseline, segment, null, null);
            }
            double absolute = segment.doubleValue() - baseline.doubleValue();
            Double percent = baseline.doubleValue() == 0.0 ? null : absolute / Math.abs(baseline.doubleValue()) * 100.0;
            return new Difference(baseline, segment, absolute, percent);
        }
    }

    private final PivotResult baseline;
    private final PivotResult segment;
    private final List<LabelTuple> rows;
    private final List<LabelTuple> columns;
    private final Map<LabelTuple, Map<LabelTuple, Map<String, Difference>>> cells;

    private SegmentComparison(PivotResult baseline, PivotResult segment,
                              List<LabelTuple> rows, List<LabelTuple> columns,
                              Map<LabelTuple, Map<LabelTuple, Map<String, Difference>>> cells) {
        this.baseline = baseline;
        this.segment = segment;
        this.rows = List.copyOf(rows);
        this.columns = List.copyOf(columns);
        this.cells = cells;
    }

    /**
     * Computes the pivot for both filters and compares them cell by cell.
     *
     * @param aggregator the aggregator to compute with
     * @param dataset the dataset
     * @param bucketRules the active bucket rules
     * @param baselineFilter the reference audience
     * @param segmentFilter the audience being compared
     * @param spec the pivot shape
     * @return the comparison
     */
    public static SegmentComparison compare(PivotAggregator aggregator,
                                            Dataset dataset,
                                            Collection<BucketRule> bucketRules,
                                            Filter baselineFilter,
                                            Filter segmentFilter,
                                            PivotSpec spec) {
        Objects.requireNonNull(aggregator, "aggregator must not be null");
        PivotAggregator.Layout layout = aggregator.prepare(dataset, bucketRules, spec);
        PivotResult baseline = aggregator.computePivot(dataset, bucketRules, baselineFilter, spec);
        PivotResult segment = aggregator.computePivot(dataset, bucketRules, segmentFilter, spec);

        List<LabelTuple> rows = union(baseline.rows(), segment.rows(), layout.rows().tupleOrder());
        List<LabelTuple> columns = union(baseline.columns(), segment.columns(), layout.columns().tupleOrder());

        Map<LabelTuple, Map<LabelTuple, Map<String, Difference>>> cells = new LinkedHashMap<>();
        for (LabelTuple row : rows) {
            Map<LabelTuple, Map<String, Difference>> rowCells = new LinkedHashMap<>();
            for (LabelTuple column : columns) {
                Optional<Map<String, Number>> base = baseline.cell(row, column);
                Optional<Map<String, Number>> seg = segment.cell(row, column);
                if (base.isEmpty() && seg.isEmpty()) {
                    continue;
                }
                Map<String, Difference> differences = new LinkedHashMap<>();
                for (String metric : baseline.metricNames()) {
                    differences.put(metric, Difference.of(
                        base.map(values -> values.get(metric)).orElse(null),
                        seg.map(values -> values.get(metric)).orElse(null)));
                }
                rowCells.put(column, differences);
            }
            if (!rowCells.isEmpty()) {
                cells.put(row, rowCells);
            }
        }

        logger.debug("Compared segment '{}' against baseline '{}': {} of {} records",
            segmentFilter.text(), baselineFilter.text(), segment.filteredCount(), baseline.filteredCount());
        return new SegmentComparison(baseline, segment, rows, columns, cells);
    }

    public PivotResult baseline() {
        return baseline;
    }

    public PivotResult segment() {
        return segment;
    }

    public List<LabelTuple> rows() {
        return rows;
    }

    public List<LabelTuple> columns() {
        return columns;
    }

    public Map<LabelTuple, Map<LabelTuple, Map<String, Difference>>> cells() {
        return cells;
    }

    public Optional<Difference> difference(LabelTuple row, LabelTuple column, String metric) {
        Map<LabelTuple, Map<String, Difference>> byColumn = cells.get(row);
        if (byColumn == null || byColumn.get(column) == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byColumn.get(column).get(metric));
    }

    /**
     * Compares the grand totals of both audiences.
     *
     * @param metric the metric name
     * @return the difference of the grand totals
     */
    public Difference grandTotal(String metric) {
        return Difference.of(baseline.grandTotal().get(metric), segment.grandTotal().get(metric));
    }

    private static List<LabelTuple> union(List<LabelTuple> first, List<LabelTuple> second,
                                          Comparator<LabelTuple> order) {
        TreeSet<LabelTuple> merged = new TreeSet<>(order);
        merged.addAll(first);
        merged.addAll(second);
        return new ArrayList<>(merged);
    }
}
