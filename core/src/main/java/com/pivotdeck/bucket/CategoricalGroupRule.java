package com.pivotdeck.bucket;

import com.pivotdeck.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Groups categorical values under labels through an explicit mapping.
 *
 * <p>Values are matched exactly (case-sensitive). A value without a mapping is
 * labelled {@link BucketLabels#OTHER}. Several values may share a label; the label
 * order is the order in which each label first appears in the mapping.
 *
 * <p>Example:
 * <pre>
 *   Gold -> "Gold+", Platinum -> "Gold+", Bronze -> "Entry"
 *
 *   "Gold" -> "Gold+", "Silver" -> "Other"
 * </pre>
 */
public final class CategoricalGroupRule implements BucketRule {

    private final String dimension;
    private final Map<String, String> mapping;
    private final List<String> labels;

    /**
     * Creates a categorical group rule.
     *
     * @param dimension the dimension to bucket
     * @param mapping value to label, in declaration order
     * @throws ConfigurationException if the mapping is empty or contains blank or reserved labels
     */
    public CategoricalGroupRule(String dimension, Map<String, String> mapping) {
        this.dimension = Objects.requireNonNull(dimension, "dimension must not be null");
        Objects.requireNonNull(mapping, "mapping must not be null");
        if (mapping.isEmpty()) {
            throw new ConfigurationException("Categorical group rule needs at least one mapping", dimension);
        }

        Map<String, String> copy = new LinkedHashMap<>();
        Set<String> distinctLabels = new LinkedHashSet<>();
        for (Map.Entry<String, String> entry : mapping.entrySet()) {
            String value = entry.getKey();
            String label = entry.getValue();
            if (value == null || label == null || label.isBlank()) {
                throw new ConfigurationException("Mapping entries need a value and a label: " + entry, dimension);
            }
            if (BucketLabels.isReserved(label)) {
                throw new ConfigurationException("Group label '" + label + "' is reserved", dimension);
            }
            copy.put(value, label);
            distinctLabels.add(label);
        }
        this.mapping = Collections.unmodifiableMap(copy);
        this.labels = Collections.unmodifiableList(new ArrayList<>(distinctLabels));
    }

    @Override
    public String dimension() {
        return dimension;
    }

    @Override
    public BucketKind kind() {
        return BucketKind.CATEGORICAL_GROUP;
    }

    public Map<String, String> mapping() {
        return mapping;
    }

    @Override
    public String apply(Object value) {
        if (value == null) {
            return BucketLabels.MISSING;
        }
        String label = mapping.get(value.toString());
        return label != null ? label : BucketLabels.OTHER;
    }

    @Override
    public List<String> declaredLabels() {
        return labels;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CategoricalGroupRule)) return false;
        CategoricalGroupRule that = (CategoricalGroupRule) o;
        return dimension.equals(that.dimension) && mapping.equals(that.mapping);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dimension, mapping);
    }

    @Override
    public String toString() {
        return "CategoricalGroupRule[" + dimension + ", " + mapping + "]";
    }
}
