package com.pivotdeck;

import com.pivotdeck.bucket.BucketKind;
import com.pivotdeck.bucket.BucketRule;
import com.pivotdeck.bucket.BucketRules;
import com.pivotdeck.catalog.DimensionCatalog;
import com.pivotdeck.data.Dataset;
import com.pivotdeck.filter.Filter;
import com.pivotdeck.metric.MetricDef;
import com.pivotdeck.metric.MetricPresets;
import com.pivotdeck.metric.MetricRegistry;
import com.pivotdeck.pivot.PivotAggregator;
import com.pivotdeck.pivot.PivotResult;
import com.pivotdeck.pivot.PivotSpec;
import com.pivotdeck.pivot.SegmentComparison;
import com.pivotdeck.pivot.SegmentInsights;
import com.pivotdeck.types.Schema;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point of the pivot engine.
 *
 * <p>Typical use:
 * <pre>
 * PivotEngine engine = new PivotEngine();
 * Dataset users = engine.loadDataset(rows, schema);
 * BucketRule ages = engine.defineBucketRule("age", BucketKind.NUMERIC_RANGE, ranges);
 * Filter mobile = engine.parseFilter("device_type = 'Mobile'", users.schema());
 * PivotResult result = engine.computePivot(users, List.of(ages), mobile,
 *     List.of("age"), List.of("country"), List.of(MetricPresets.COUNT), false);
 * </pre>
 *
 * <p>Every operation validates its input eagerly and throws a
 * {@link com.pivotdeck.exception.PivotException} subclass for invalid configuration.
 * The engine itself is stateless apart from its metric registry, which is only read
 * during computation.
 */
public class PivotEngine {

    private final MetricRegistry metricRegistry;
    private final PivotAggregator aggregator;

    /**
     * Creates an engine with the preset metrics registered.
     */
    public PivotEngine() {
        this(MetricPresets.newRegistry());
    }

    public PivotEngine(MetricRegistry metricRegistry) {
        this.metricRegistry = Objects.requireNonNull(metricRegistry, "metricRegistry must not be null");
        this.aggregator = new PivotAggregator(metricRegistry);
    }

    public MetricRegistry metricRegistry() {
        return metricRegistry;
    }

    public Dataset loadDataset(List<? extends Map<String, ?>> records, Schema schema) {
        return Dataset.load(records, schema);
    }

    /**
     * Defines and validates a bucket rule.
     *
     * @param dimension the dimension to bucket
     * @param kind the rule kind
     * @param definition ranges, a value-to-label map or a granularity, depending on the kind
     * @return the rule
     */
    public BucketRule defineBucketRule(String dimension, BucketKind kind, Object definition) {
        return BucketRules.define(dimension, kind, definition);
    }

    public Filter parseFilter(String expressionText, Schema schema) {
        return Filter.parse(expressionText, DimensionCatalog.fromSchema(schema));
    }

    public PivotResult computePivot(Dataset dataset,
                                    Collection<BucketRule> bucketRules,
                                    Filter filter,
                                    List<String> rowDimensions,
                                    List<String> columnDimensions,
                                    List<MetricDef> metrics,
                                    boolean showEmpty) {
        PivotSpec spec = PivotSpec.builder()
            .rows(rowDimensions)
            .columns(columnDimensions)
            .metrics(metrics)
            .showEmpty(showEmpty)
            .build();
        return computePivot(dataset, bucketRules, filter, spec);
    }

    public PivotResult computePivot(Dataset dataset, Collection<BucketRule> bucketRules, Filter filter, PivotSpec spec) {
        return aggregator.computePivot(dataset, bucketRules, filter, spec);
    }

    public SegmentComparison compareSegments(Dataset dataset, Collection<BucketRule> bucketRules,
                                             Filter baseline, Filter segment, PivotSpec spec) {
        return SegmentComparison.compare(aggregator, dataset, bucketRules, baseline, segment, spec);
    }

    public SegmentInsights insights(Dataset dataset, BucketRule rule, Filter filter, String dimension, String field) {
        return SegmentInsights.analyze(dataset, rule, filter, dimension, field);
    }
}
