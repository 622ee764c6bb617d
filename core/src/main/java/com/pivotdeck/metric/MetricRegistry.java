package com.pivotdeck.metric;

import com.pivotdeck.data.Record;
import com.pivotdeck.exception.ComputationException;
import com.pivotdeck.exception.ConfigurationException;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Named metric definitions plus the computation of metric values over record groups.
 *
 * <p>Metric kinds are dispatched through a fixed lookup table from {@link MetricKind}
 * to its computation. Values:
 * <ul>
 *   <li>{@code count}: number of records in the group ({@code Long})</li>
 *   <li>{@code sum(field)}: exact sum of present values, 0.0 for an empty group</li>
 *   <li>{@code mean(field)}: mean of present values, null if there are none</li>
 *   <li>{@code distinctCount(field)}: number of distinct present values ({@code Long})</li>
 *   <li>{@code ratio(numerator, denominator)}: quotient of two other metrics of the same
 *       group; null when the denominator is zero or null, or the numerator is null</li>
 * </ul>
 *
 * <p>Boolean fields count as 1 (true) and 0 (false) for sum and mean, so the mean of
 * a flag is the share of records where it is set.
 *
 * <p>A registry belongs to one session. Ratios may reference metrics that are only
 * registered here and not requested; such dependencies are computed but not emitted.
 */
public final class MetricRegistry {

    private static final Map<MetricKind, MetricFunction> FUNCTIONS = new EnumMap<>(MetricKind.class);

    static {
        FUNCTIONS.put(MetricKind.COUNT, (group, def, resolved) -> (long) group.size());
        FUNCTIONS.put(MetricKind.SUM, (group, def, resolved) -> exactSum(group, field(def)).doubleValue());
        FUNCTIONS.put(MetricKind.MEAN, MetricRegistry::mean);
        FUNCTIONS.put(MetricKind.DISTINCT_COUNT, MetricRegistry::distinctCount);
        FUNCTIONS.put(MetricKind.RATIO, MetricRegistry::ratio);
    }

    private final Map<String, MetricDef> definitions = new LinkedHashMap<>();

    /**
     * Registers a metric under a name.
     *
     * @param name the metric name; must equal {@code def.name()}
     * @param def the definition
     * @throws ConfigurationException if the name and the definition disagree
     */
    public void register(String name, MetricDef def) {
        if (!def.name().equals(name)) {
            throw new ConfigurationException("Metric registered as '" + name + "' is named '" + def.name() + "'", name);
        }
        definitions.put(name, def);
    }

    public void register(MetricDef def) {
        register(def.name(), def);
    }

    public Optional<MetricDef> lookup(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    public List<String> names() {
        return List.copyOf(definitions.keySet());
    }

    /**
     * Resolves requested metrics and their dependencies into an evaluation plan.
     *
     * @param requested the metrics to emit, in output order
     * @return the plan
     * @throws ComputationException if a ratio dependency is cyclic or cannot be resolved
     * @throws ConfigurationException if two requested metrics share a name
     */
    public MetricPlan resolve(List<MetricDef> requested) {
        Map<String, MetricDef> byName = new LinkedHashMap<>();
        for (MetricDef def : requested) {
            if (byName.put(def.name(), def) != null) {
                throw new ConfigurationException("Duplicate metric name", def.name());
            }
        }

        List<MetricDef> order = new ArrayList<>();
        Map<String, Boolean> state = new HashMap<>();
        for (MetricDef def : requested) {
            visit(def, byName, state, order, new ArrayList<>());
        }

        List<String> outputs = new ArrayList<>(byName.keySet());
        return new MetricPlan(order, outputs);
    }

    /**
     * Computes metrics for one group.
     *
     * @param group the records of the group
     * @param defs the requested metrics
     * @return metric name to value, in request order
     */
    public Map<String, Number> compute(List<Record> group, List<MetricDef> defs) {
        return resolve(defs).compute(group);
    }

    private void visit(MetricDef def, Map<String, MetricDef> requested, Map<String, Boolean> state,
                       List<MetricDef> order, List<String> path) {
        Boolean done = state.get(def.name());
        if (Boolean.TRUE.equals(done)) {
            return;
        }
        path.add(def.name());
        if (Boolean.FALSE.equals(done)) {
            throw new ComputationException("Cyclic metric dependency: " + String.join(" -> ", path), def.name());
        }

        state.put(def.name(), Boolean.FALSE);
        if (def.isRatio()) {
            for (String dependency : def.sourceFields()) {
                MetricDef resolved = requested.get(dependency);
                if (resolved == null) {
                    resolved = definitions.get(dependency);
                }
                if (resolved == null) {
                    throw new ComputationException("Unresolved metric dependency '" + dependency + "'", def.name());
                }
                visit(resolved, requested, state, order, path);
            }
        }
        state.put(def.name(), Boolean.TRUE);
        path.remove(path.size() - 1);
        order.add(def);
    }

    static Number evaluate(MetricDef def, List<Record> group, Map<String, Number> resolved) {
        return FUNCTIONS.get(def.kind()).compute(group, def, resolved);
    }

    // ==================== Metric Functions ====================

    private static String field(MetricDef def) {
        return def.sourceFields().get(0);
    }

    private static BigDecimal exactSum(List<Record> group, String field) {
        BigDecimal total = BigDecimal.ZERO;
        for (Record record : group) {
            BigDecimal value = numericValue(record.get(field));
            if (value != null) {
                total = total.add(value);
            }
        }
        return total;
    }

    private static Number mean(List<Record> group, MetricDef def, Map<String, Number> resolved) {
        String field = field(def);
        BigDecimal total = BigDecimal.ZERO;
        long present = 0;
        for (Record record : group) {
            BigDecimal value = numericValue(record.get(field));
            if (value != null) {
                total = total.add(value);
                present++;
            }
        }
        if (present == 0) {
            return null;
        }
        return total.divide(BigDecimal.valueOf(present), MathContext.DECIMAL128).doubleValue();
    }

    private static Number distinctCount(List<Record> group, MetricDef def, Map<String, Number> resolved) {
        String field = field(def);
        Set<Object> distinct = new HashSet<>();
        for (Record record : group) {
            Object value = record.get(field);
            if (value != null) {
                distinct.add(value);
            }
        }
        return (long) distinct.size();
    }

    private static Number ratio(List<Record> group, MetricDef def, Map<String, Number> resolved) {
        Number numerator = resolved.get(def.sourceFields().get(0));
        Number denominator = resolved.get(def.sourceFields().get(1));
        if (numerator == null || denominator == null || denominator.doubleValue() == 0.0) {
            return null;
        }
        return numerator.doubleValue() / denominator.doubleValue();
    }

    private static BigDecimal numericValue(Object value) {
        if (value instanceof Double d) {
            return Double.isFinite(d) ? new BigDecimal(d) : null;
        }
        if (value instanceof Number n) {
            return new BigDecimal(n.doubleValue());
        }
        if (value instanceof Boolean b) {
            return b ? BigDecimal.ONE : BigDecimal.ZERO;
        }
        return null;
    }

    @Override
    public String toString() {
        return "MetricRegistry" + Collections.unmodifiableSet(definitions.keySet());
    }
}
