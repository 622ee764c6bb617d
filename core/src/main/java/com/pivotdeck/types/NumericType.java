package com.pivotdeck.types;

/**
 * Data type for numeric dimensions.
 *
 * <p>All numeric values are stored as {@link Double}, whether they were produced as
 * integers (ages, order counts) or as decimals (revenue, scores).
 */
public final class NumericType implements DataType {

    private static final NumericType INSTANCE = new NumericType();

    private NumericType() {}

    public static NumericType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "numeric";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof NumericType;
    }

    @Override
    public int hashCode() {
        return typeName().hashCode();
    }

    @Override
    public String toString() {
        return typeName();
    }
}
