package com.pivotdeck.pivot;

import com.pivotdeck.bucket.BucketRule;
import com.pivotdeck.bucket.BucketRules;
import com.pivotdeck.catalog.DimensionCatalog;
import com.pivotdeck.data.Dataset;
import com.pivotdeck.data.Record;
import com.pivotdeck.exception.ConfigurationException;
import com.pivotdeck.filter.Filter;
import com.pivotdeck.metric.MetricPlan;
import com.pivotdeck.metric.MetricRegistry;
import com.pivotdeck.types.DataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes pivot tables: filter, then bucket, then group, then metrics.
 *
 * <p>Steps:
 * <ol>
 *   <li>Validate the spec, bucket rules and metrics against the dataset's catalog.
 *       Nothing is read from the dataset until this succeeds.</li>
 *   <li>Select the records that pass the filter.</li>
 *   <li>In a single pass, label each record on both axes and append it to its cell
 *       group, its row group, its column group.</li>
 *   <li>Evaluate the metric plan once per group.</li>
 * </ol>
 *
 * <p>Row and column totals come from the row and column groups and the grand total
 * from the whole filtered subset, never from cell values, so means and ratios in
 * totals are exact.
 *
 * <p>The aggregator holds no state between calls and never modifies its inputs.
 */
public final class PivotAggregator {

    private static final Logger logger = LoggerFactory.getLogger(PivotAggregator.class);

    private final MetricRegistry metricRegistry;

    public PivotAggregator(MetricRegistry metricRegistry) {
        this.metricRegistry = Objects.requireNonNull(metricRegistry, "metricRegistry must not be null");
    }

    /**
     * Computes a pivot.
     *
     * @param dataset the dataset
     * @param bucketRules rules for bucketed dimensions; dimensions without a rule use raw values
     * @param filter the row filter ({@link Filter#all()} for none)
     * @param spec the pivot shape
     * @return the result
     * @throws ConfigurationException if a rule does not fit its dimension or two rules target one dimension
     * @throws com.pivotdeck.exception.UnknownDimensionException if the spec, a rule or a metric names an
     *         unregistered dimension
     * @throws com.pivotdeck.exception.ComputationException if metric dependencies cannot be resolved
     */
    public PivotResult computePivot(Dataset dataset, Collection<BucketRule> bucketRules, Filter filter, PivotSpec spec) {
        Objects.requireNonNull(dataset, "dataset must not be null");
        Objects.requireNonNull(bucketRules, "bucketRules must not be null");
        Objects.requireNonNull(filter, "filter must not be null");
        Objects.requireNonNull(spec, "spec must not be null");

        Layout layout = prepare(dataset, bucketRules, spec);
        AxisLabeler rowLabeler = layout.rows();
        AxisLabeler columnLabeler = layout.columns();
        MetricPlan plan = layout.metrics();

        List<Record> filtered = filter.select(dataset.records());

        Map<LabelTuple, Map<LabelTuple, List<Record>>> cellGroups = new HashMap<>();
        Map<LabelTuple, List<Record>> rowGroups = new HashMap<>();
        Map<LabelTuple, List<Record>> columnGroups = new HashMap<>();
        for (Record record : filtered) {
            LabelTuple row = rowLabeler.label(record);
            LabelTuple column = columnLabeler.label(record);
            cellGroups.computeIfAbsent(row, r -> new HashMap<>())
                .computeIfAbsent(column, c -> new ArrayList<>())
                .add(record);
            rowGroups.computeIfAbsent(row, r -> new ArrayList<>()).add(record);
            columnGroups.computeIfAbsent(column, c -> new ArrayList<>()).add(record);
        }

        boolean showEmpty = spec.showEmpty();
        boolean singleCell = rowLabeler.isEmpty() && columnLabeler.isEmpty();
        List<LabelTuple> rows = rowLabeler.axis(rowGroups.keySet(), showEmpty);
        List<LabelTuple> columns = columnLabeler.axis(columnGroups.keySet(), showEmpty);

        Map<LabelTuple, Map<LabelTuple, Map<String, Number>>> cells = new LinkedHashMap<>();
        for (LabelTuple row : rows) {
            Map<LabelTuple, List<Record>> byColumn = cellGroups.getOrDefault(row, Map.of());
            Map<LabelTuple, Map<String, Number>> rowCells = new LinkedHashMap<>();
            for (LabelTuple column : columns) {
                List<Record> group = byColumn.get(column);
                if (group == null && !showEmpty && !singleCell) {
                    continue;
                }
                rowCells.put(column, plan.compute(group != null ? group : List.of()));
            }
            if (!rowCells.isEmpty()) {
                cells.put(row, rowCells);
            }
        }

        Map<LabelTuple, Map<String, Number>> rowTotals = new LinkedHashMap<>();
        for (LabelTuple row : rows) {
            rowTotals.put(row, plan.compute(rowGroups.getOrDefault(row, List.of())));
        }
        Map<LabelTuple, Map<String, Number>> columnTotals = new LinkedHashMap<>();
        for (LabelTuple column : columns) {
            columnTotals.put(column, plan.compute(columnGroups.getOrDefault(column, List.of())));
        }
        Map<String, Number> grandTotal = plan.compute(filtered);

        PivotResult result = new PivotResult(rows, columns, plan.outputNames(), cells,
            rowTotals, columnTotals, grandTotal, filtered.size());
        logger.debug("Computed pivot over {} of {} records: {}", filtered.size(), dataset.size(), result);
        return result;
    }

    /**
     * Validates a pivot request without reading any record.
     *
     * @param dataset the dataset whose schema the request is checked against
     * @param bucketRules the bucket rules
     * @param spec the pivot shape
     * @throws com.pivotdeck.exception.PivotException if the request is invalid
     */
    public void validate(Dataset dataset, Collection<BucketRule> bucketRules, PivotSpec spec) {
        prepare(dataset, bucketRules, spec);
    }

    /**
     * Validates a pivot request against the dataset and builds its axis labelers and metric plan.
     */
    Layout prepare(Dataset dataset, Collection<BucketRule> bucketRules, PivotSpec spec) {
        DimensionCatalog catalog = DimensionCatalog.fromSchema(dataset.schema());
        Map<String, BucketRule> rules = indexRules(bucketRules, catalog);
        Map<String, DataType> types = new HashMap<>();
        for (String dimension : spec.rowDimensions()) {
            types.put(dimension, catalog.describe(dimension).type());
        }
        for (String dimension : spec.columnDimensions()) {
            types.put(dimension, catalog.describe(dimension).type());
        }
        MetricPlan plan = metricRegistry.resolve(spec.metrics());
        plan.validate(catalog);
        return new Layout(
            new AxisLabeler(spec.rowDimensions(), rules, types),
            new AxisLabeler(spec.columnDimensions(), rules, types),
            plan);
    }

    record Layout(AxisLabeler rows, AxisLabeler columns, MetricPlan metrics) {
    }

    private static Map<String, BucketRule> indexRules(Collection<BucketRule> bucketRules, DimensionCatalog catalog) {
        Map<String, BucketRule> rules = new HashMap<>();
        for (BucketRule rule : bucketRules) {
            BucketRules.validateFor(rule, catalog);
            if (rules.put(rule.dimension(), rule) != null) {
                throw new ConfigurationException("More than one bucket rule for dimension", rule.dimension());
            }
        }
        return rules;
    }
}
