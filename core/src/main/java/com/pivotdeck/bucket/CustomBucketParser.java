package com.pivotdeck.bucket;

import com.pivotdeck.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses analyst-typed bucket edges into a {@link NumericRangeRule}.
 *
 * <p>The text is a comma-separated list of ascending edges. Consecutive edges form
 * contiguous half-open ranges, labelled by their bounds. A final edge written with a
 * trailing {@code +} opens the last range upwards:
 * <pre>
 *   "0, 25, 50"      -> [0, 25) "0-25", [25, 50) "25-50"
 *   "0, 100, 500+"   -> [0, 100) "0-100", [100, 500) "100-500", [500, +inf) "500+"
 * </pre>
 */
public final class CustomBucketParser {

    private CustomBucketParser() {}

    /**
     * Parses edge text into a rule.
     *
     * @param dimension the dimension to bucket
     * @param text the comma-separated edges
     * @return the validated rule
     * @throws ConfigurationException if an edge is not a number, edges are not strictly
     *         ascending, or fewer than two edges are given without an open final edge
     */
    public static NumericRangeRule parse(String dimension, String text) {
        if (text == null || text.isBlank()) {
            throw new ConfigurationException("Custom bucket edges must not be empty", dimension);
        }

        String[] parts = text.split(",");
        List<Double> edges = new ArrayList<>(parts.length);
        List<String> edgeText = new ArrayList<>(parts.length);
        boolean openEnded = false;
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i].trim();
            if (part.endsWith("+")) {
                if (i != parts.length - 1) {
                    throw new ConfigurationException("Only the last edge may be open-ended: " + part, dimension);
                }
                openEnded = true;
                part = part.substring(0, part.length() - 1).trim();
            }
            try {
                edges.add(Double.valueOf(part));
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Bucket edge is not a number: '" + part + "'", dimension, e);
            }
            edgeText.add(part);
        }

        if (edges.size() < 2 && !openEnded) {
            throw new ConfigurationException("At least two edges are needed: " + text, dimension);
        }
        for (int i = 1; i < edges.size(); i++) {
            if (edges.get(i) <= edges.get(i - 1)) {
                throw new ConfigurationException("Bucket edges must be strictly ascending: " + text, dimension);
            }
        }

        List<NumericRange> ranges = new ArrayList<>();
        for (int i = 0; i + 1 < edges.size(); i++) {
            ranges.add(NumericRange.of(edges.get(i), edges.get(i + 1), edgeText.get(i) + "-" + edgeText.get(i + 1)));
        }
        if (openEnded) {
            int last = edges.size() - 1;
            ranges.add(NumericRange.atLeast(edges.get(last), edgeText.get(last) + "+"));
        }
        return new NumericRangeRule(dimension, ranges);
    }
}
