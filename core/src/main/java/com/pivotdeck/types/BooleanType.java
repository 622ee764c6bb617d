package com.pivotdeck.types;

/**
 * Data type for true/false flags.
 */
public final class BooleanType implements DataType {

    private static final BooleanType INSTANCE = new BooleanType();

    private BooleanType() {}

    public static BooleanType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "boolean";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof BooleanType;
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
