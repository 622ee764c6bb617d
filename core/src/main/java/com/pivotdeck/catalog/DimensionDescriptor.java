package com.pivotdeck.catalog;

import com.pivotdeck.filter.ComparisonOperator;
import com.pivotdeck.types.DataType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Catalog entry for one dimension: its declared type and the filter operators legal against it.
 */
public record DimensionDescriptor(String name, DataType type, Set<ComparisonOperator> allowedOperators) {

    public DimensionDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        allowedOperators = Collections.unmodifiableSet(EnumSet.copyOf(allowedOperators));
    }

    public boolean allows(ComparisonOperator operator) {
        return allowedOperators.contains(operator);
    }
}
