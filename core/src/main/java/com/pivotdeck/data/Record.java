package com.pivotdeck.data;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One user row: an immutable mapping from dimension name to typed value.
 *
 * <p>A dimension is <em>missing</em> when the record has no entry for it. Values are
 * already coerced to their declared type by {@link Dataset#load}, so a present value is
 * one of {@code Double}, {@code String}, {@code LocalDate} or {@code Boolean}.
 */
public final class Record {

    private final Map<String, Object> values;

    /**
     * Creates a record. Null values are dropped and therefore read as missing.
     *
     * @param values dimension name to typed value
     */
    public Record(Map<String, ?> values) {
        Objects.requireNonNull(values, "values must not be null");
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((name, value) -> {
            if (value != null) {
                copy.put(name, value);
            }
        });
        this.values = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns the value for a dimension.
     *
     * @param dimension the dimension name
     * @return the typed value, or null if missing
     */
    public Object get(String dimension) {
        return values.get(dimension);
    }

    public boolean isMissing(String dimension) {
        return !values.containsKey(dimension);
    }

    /**
     * Returns all present values.
     *
     * @return an unmodifiable view of the values
     */
    public Map<String, Object> values() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Record)) return false;
        return values.equals(((Record) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Record" + values;
    }
}
