package com.pivotdeck.data;

import com.pivotdeck.exception.TypeMismatchException;
import com.pivotdeck.exception.UnknownDimensionException;
import com.pivotdeck.types.Schema;
import com.pivotdeck.types.SchemaField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable, ordered collection of {@link Record}s with their {@link Schema}.
 *
 * <p>A dataset is produced once (typically by the data generator) and never mutated.
 * Regenerating data produces a new dataset with a new id, so sessions holding the old
 * dataset keep seeing consistent data.
 */
public final class Dataset {

    private static final Logger logger = LoggerFactory.getLogger(Dataset.class);

    private final String id;
    private final Schema schema;
    private final List<Record> records;

    private Dataset(String id, Schema schema, List<Record> records) {
        this.id = id;
        this.schema = schema;
        this.records = Collections.unmodifiableList(records);
    }

    /**
     * Loads raw rows into a dataset, coercing each value to its declared type.
     *
     * @param rows raw rows (dimension name to raw value; null or absent means missing)
     * @param schema the declared schema
     * @return the immutable dataset
     * @throws UnknownDimensionException if a row contains a field not in the schema
     * @throws TypeMismatchException if a value cannot be coerced, or a non-nullable field is missing
     */
    public static Dataset load(List<? extends Map<String, ?>> rows, Schema schema) {
        Objects.requireNonNull(rows, "rows must not be null");
        Objects.requireNonNull(schema, "schema must not be null");

        List<Record> records = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            records.add(toRecord(i, rows.get(i), schema));
        }

        Dataset dataset = new Dataset(UUID.randomUUID().toString(), schema, records);
        logger.debug("Loaded dataset {} with {} records and {} fields",
            dataset.id, records.size(), schema.size());
        return dataset;
    }

    private static Record toRecord(int index, Map<String, ?> row, Schema schema) {
        for (String name : row.keySet()) {
            if (!schema.contains(name)) {
                throw new UnknownDimensionException(name, schema.fieldNames());
            }
        }

        Map<String, Object> values = new LinkedHashMap<>();
        for (SchemaField field : schema.fields()) {
            Object raw = row.get(field.name());
            if (raw == null) {
                if (!field.nullable()) {
                    throw new TypeMismatchException(
                        "Record " + index + " is missing required field", field.name(), field.dataType(), null);
                }
                continue;
            }
            Object coerced = ValueCoercion.coerce(raw, field.dataType());
            if (coerced == null) {
                throw new TypeMismatchException(
                    "Record " + index + " has a value of the wrong type",
                    field.name(), field.dataType(), String.valueOf(raw));
            }
            values.put(field.name(), coerced);
        }
        return new Record(values);
    }

    public String id() {
        return id;
    }

    public Schema schema() {
        return schema;
    }

    /**
     * Returns the records in load order.
     *
     * @return an unmodifiable list of records
     */
    public List<Record> records() {
        return records;
    }

    public int size() {
        return records.size();
    }

    @Override
    public String toString() {
        return String.format("Dataset[id=%s, records=%d, fields=%d]", id, records.size(), schema.size());
    }
}
