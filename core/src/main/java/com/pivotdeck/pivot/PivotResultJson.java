package com.pivotdeck.pivot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Objects;

/**
 * Serializes a {@link PivotResult} for the rendering layer.
 *
 * <p>Output shape:
 * <pre>
 * {
 *   "rows": ["18-24", "25-34"],
 *   "columns": ["US", "DE"],
 *   "cells": {"18-24": {"US": {"count": 12, "avg_ltv": 340.5}}},
 *   "rowTotals": {"18-24": {"count": 20, "avg_ltv": 310.0}},
 *   "columnTotals": {"US": {"count": 30, "avg_ltv": 355.2}},
 *   "grandTotal": {"count": 50, "avg_ltv": 331.9}
 * }
 * </pre>
 *
 * <p>Labels are {@link LabelTuple#displayName()}s, so multi-dimension tuples appear as
 * {@code "18-24 / US"} and the empty tuple as {@code "All"}. Undefined values are JSON
 * {@code null}. When a non-negative scale is set, floating-point values are rounded
 * half-up to that many decimals; the result itself is never modified.
 */
public final class PivotResultJson {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final int scale;

    /**
     * Creates a serializer that writes values unrounded.
     */
    public PivotResultJson() {
        this(-1);
    }

    /**
     * Creates a serializer with a display scale.
     *
     * @param scale decimals to round floating-point values to, or negative for no rounding
     */
    public PivotResultJson(int scale) {
        this.scale = scale;
    }

    public ObjectNode toJsonNode(PivotResult result) {
        Objects.requireNonNull(result, "result must not be null");
        ObjectNode root = objectMapper.createObjectNode();

        ArrayNode rows = root.putArray("rows");
        result.rows().forEach(row -> rows.add(row.displayName()));
        ArrayNode columns = root.putArray("columns");
        result.columns().forEach(column -> columns.add(column.displayName()));

        ObjectNode cells = root.putObject("cells");
        result.cells().forEach((row, byColumn) -> {
            ObjectNode rowNode = cells.putObject(row.displayName());
            byColumn.forEach((column, values) -> writeMetrics(rowNode.putObject(column.displayName()), values));
        });

        ObjectNode rowTotals = root.putObject("rowTotals");
        result.rowTotals().forEach((row, values) -> writeMetrics(rowTotals.putObject(row.displayName()), values));
        ObjectNode columnTotals = root.putObject("columnTotals");
        result.columnTotals().forEach(
            (column, values) -> writeMetrics(columnTotals.putObject(column.displayName()), values));
        writeMetrics(root.putObject("grandTotal"), result.grandTotal());
        return root;
    }

    /**
     * Serializes a result to a JSON string.
     *
     * @param result the pivot result
     * @return compact JSON text
     */
    public String toJson(PivotResult result) {
        try {
            return objectMapper.writeValueAsString(toJsonNode(result));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize pivot result: " + e.getMessage(), e);
        }
    }

    private void writeMetrics(ObjectNode node, Map<String, Number> values) {
        values.forEach((metric, value) -> {
            if (value == null) {
                node.putNull(metric);
            } else if (value instanceof Long || value instanceof Integer) {
                node.put(metric, value.longValue());
            } else if (scale >= 0 && Double.isFinite(value.doubleValue())) {
                node.put(metric, BigDecimal.valueOf(value.doubleValue()).setScale(scale, RoundingMode.HALF_UP));
            } else {
                node.put(metric, value.doubleValue());
            }
        });
    }
}
