package com.pivotdeck.metric;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Dashboard metrics over the user dimensions.
 *
 * <p>"Retention Rate" is the mean of the {@code is_retained} flag, i.e. a share in
 * [0, 1]. "AOV" is total revenue over total orders, computed as a ratio so that
 * groups without orders report null.
 */
public final class MetricPresets {

    public static final MetricDef COUNT = MetricDef.count("Count");
    public static final MetricDef TOTAL_REVENUE = MetricDef.sum("Total Revenue", "total_revenue");
    public static final MetricDef AVG_LTV = MetricDef.mean("Avg LTV", "ltv");
    public static final MetricDef RETENTION_RATE = MetricDef.mean("Retention Rate", "is_retained");
    public static final MetricDef AVG_AOV = MetricDef.mean("Avg AOV", "average_order_value");
    public static final MetricDef TOTAL_ORDERS = MetricDef.sum("Total Orders", "total_orders");
    public static final MetricDef AOV = MetricDef.ratio("AOV", TOTAL_REVENUE.name(), TOTAL_ORDERS.name());

    private static final Map<String, MetricDef> PRESETS = new LinkedHashMap<>();

    static {
        for (MetricDef def : List.of(COUNT, TOTAL_REVENUE, AVG_LTV, RETENTION_RATE, AVG_AOV, TOTAL_ORDERS, AOV)) {
            PRESETS.put(def.name(), def);
        }
    }

    private MetricPresets() {}

    public static List<String> names() {
        return List.copyOf(PRESETS.keySet());
    }

    public static Optional<MetricDef> get(String name) {
        return Optional.ofNullable(PRESETS.get(name));
    }

    /**
     * Creates a registry holding every preset.
     *
     * @return a new registry
     */
    public static MetricRegistry newRegistry() {
        MetricRegistry registry = new MetricRegistry();
        PRESETS.values().forEach(registry::register);
        return registry;
    }
}
