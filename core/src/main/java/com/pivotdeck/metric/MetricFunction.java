package com.pivotdeck.metric;

import com.pivotdeck.data.Record;

import java.util.List;
import java.util.Map;

/**
 * Computes one metric kind over a group of records.
 */
@FunctionalInterface
interface MetricFunction {

    /**
     * Computes the metric.
     *
     * @param group the records of the group (possibly empty)
     * @param def the metric definition
     * @param resolved values of metrics already computed for the same group, by name
     * @return the value: a {@code Long} or {@code Double}, or null where undefined
     */
    Number compute(List<Record> group, MetricDef def, Map<String, Number> resolved);
}
