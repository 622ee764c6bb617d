package com.pivotdeck.types;

import com.pivotdeck.exception.ConfigurationException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered set of declared dimensions: the schema of a dataset.
 *
 * <p>Field names are unique; lookup by name is constant time.
 */
public final class Schema {

    /** Empty schema with no fields. */
    public static final Schema EMPTY = new Schema(Collections.emptyList());

    private final List<SchemaField> fields;
    private final Map<String, SchemaField> byName;

    /**
     * Creates a schema with the given fields.
     *
     * @param fields the fields in declaration order
     * @throws ConfigurationException if two fields share a name
     */
    public Schema(List<SchemaField> fields) {
        Objects.requireNonNull(fields, "fields must not be null");
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
        Map<String, SchemaField> index = new LinkedHashMap<>();
        for (SchemaField field : fields) {
            if (index.put(field.name(), field) != null) {
                throw new ConfigurationException("Duplicate field in schema", field.name());
            }
        }
        this.byName = Collections.unmodifiableMap(index);
    }

    public Schema(SchemaField... fields) {
        this(Arrays.asList(fields));
    }

    /**
     * Returns the fields in declaration order.
     *
     * @return an unmodifiable list of fields
     */
    public List<SchemaField> fields() {
        return fields;
    }

    public int size() {
        return fields.size();
    }

    /**
     * Returns the field with the given name, or null if not found.
     *
     * @param name the field name
     * @return the field, or null if not found
     */
    public SchemaField fieldByName(String name) {
        return byName.get(name);
    }

    public boolean contains(String name) {
        return byName.containsKey(name);
    }

    /**
     * Returns the field names in declaration order.
     *
     * @return an unmodifiable list of names
     */
    public List<String> fieldNames() {
        return List.copyOf(byName.keySet());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Schema that = (Schema) o;
        return Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "Schema(" + fields + ")";
    }
}
