package com.pivotdeck.types;

import java.util.Objects;

/**
 * Represents a dimension declared in a {@link Schema}.
 *
 * <p>Each field has a name, data type, and nullability flag. Nullable fields may be
 * missing from individual records.
 */
public record SchemaField(String name, DataType dataType, boolean nullable) {

    /**
     * Creates a schema field.
     *
     * @param name the dimension name
     * @param dataType the declared type
     * @param nullable whether records may omit this field
     */
    public SchemaField {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(dataType, "dataType must not be null");
    }

    /**
     * Creates a nullable schema field.
     *
     * @param name the dimension name
     * @param dataType the declared type
     */
    public SchemaField(String name, DataType dataType) {
        this(name, dataType, true);
    }

    @Override
    public String toString() {
        return name + ": " + dataType + (nullable ? "" : " NOT NULL");
    }
}
