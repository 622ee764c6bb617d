package com.pivotdeck.metric;

import com.pivotdeck.catalog.DimensionCatalog;
import com.pivotdeck.data.Record;
import com.pivotdeck.exception.TypeMismatchException;
import com.pivotdeck.types.BooleanType;
import com.pivotdeck.types.DataType;
import com.pivotdeck.types.NumericType;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Resolved metrics in dependency order, ready to be evaluated once per group.
 *
 * <p>Produced by {@link MetricRegistry#resolve}. Dependencies come before the ratios
 * that use them; only the requested metrics appear in the output.
 */
public final class MetricPlan {

    private final List<MetricDef> evaluationOrder;
    private final List<String> outputNames;

    MetricPlan(List<MetricDef> evaluationOrder, List<String> outputNames) {
        this.evaluationOrder = List.copyOf(evaluationOrder);
        this.outputNames = List.copyOf(outputNames);
    }

    public List<MetricDef> evaluationOrder() {
        return evaluationOrder;
    }

    /**
     * Returns the names of the emitted metrics, in request order.
     *
     * @return the output names
     */
    public List<String> outputNames() {
        return outputNames;
    }

    /**
     * Checks every source field against the catalog.
     *
     * @param catalog the dimension catalog
     * @throws com.pivotdeck.exception.UnknownDimensionException if a source field is not registered
     * @throws TypeMismatchException if sum or mean reads a field that is neither numeric nor boolean
     */
    public void validate(DimensionCatalog catalog) {
        for (MetricDef def : evaluationOrder) {
            switch (def.kind()) {
                case SUM, MEAN -> {
                    String field = def.sourceFields().get(0);
                    DataType type = catalog.describe(field).type();
                    if (!(type instanceof NumericType) && !(type instanceof BooleanType)) {
                        throw new TypeMismatchException(
                            def.kind().name().toLowerCase(Locale.ROOT) + " of metric '" + def.name() +
                                "' needs a numeric or boolean field", field, type, null);
                    }
                }
                case DISTINCT_COUNT -> catalog.describe(def.sourceFields().get(0));
                default -> {
                }
            }
        }
    }

    /**
     * Computes every requested metric for one group.
     *
     * @param group the records of the group (may be empty)
     * @return metric name to value, in request order; values may be null
     */
    public Map<String, Number> compute(List<Record> group) {
        Map<String, Number> resolved = new HashMap<>();
        for (MetricDef def : evaluationOrder) {
            resolved.put(def.name(), MetricRegistry.evaluate(def, group, resolved));
        }
        Map<String, Number> output = new LinkedHashMap<>();
        for (String name : outputNames) {
            output.put(name, resolved.get(name));
        }
        return Collections.unmodifiableMap(output);
    }

    @Override
    public String toString() {
        return "MetricPlan" + evaluationOrder;
    }
}
