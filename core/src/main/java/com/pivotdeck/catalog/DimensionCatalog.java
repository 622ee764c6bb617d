package com.pivotdeck.catalog;

import com.pivotdeck.exception.UnknownDimensionException;
import com.pivotdeck.filter.ComparisonOperator;
import com.pivotdeck.types.BooleanType;
import com.pivotdeck.types.DataType;
import com.pivotdeck.types.DateType;
import com.pivotdeck.types.NumericType;
import com.pivotdeck.types.Schema;
import com.pivotdeck.types.SchemaField;
import com.pivotdeck.types.StringType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.pivotdeck.filter.ComparisonOperator.*;

/**
 * Read-only registry of the dimensions a dataset declares.
 *
 * <p>Built once from a {@link Schema}. Every other component resolves dimension
 * names through the catalog, so an unregistered name fails the same way everywhere:
 * with an {@link UnknownDimensionException} that lists the registered names.
 *
 * <p>Operators by type:
 * <ul>
 *   <li>numeric: {@code = != > >= < <= in}</li>
 *   <li>string: {@code = != contains in}</li>
 *   <li>date: {@code = != > >= < <= in}</li>
 *   <li>boolean: {@code = !=}</li>
 * </ul>
 */
public final class DimensionCatalog {

    private static final Set<ComparisonOperator> NUMERIC_OPERATORS = Collections.unmodifiableSet(EnumSet.of(
        EQUAL, NOT_EQUAL, GREATER_THAN, GREATER_THAN_OR_EQUAL, LESS_THAN, LESS_THAN_OR_EQUAL, IN));
    private static final Set<ComparisonOperator> STRING_OPERATORS = Collections.unmodifiableSet(EnumSet.of(
        EQUAL, NOT_EQUAL, CONTAINS, IN));
    private static final Set<ComparisonOperator> BOOLEAN_OPERATORS = Collections.unmodifiableSet(EnumSet.of(
        EQUAL, NOT_EQUAL));

    private final Map<String, DimensionDescriptor> dimensions;

    private DimensionCatalog(Map<String, DimensionDescriptor> dimensions) {
        this.dimensions = Collections.unmodifiableMap(dimensions);
    }

    /**
     * Builds a catalog from a schema.
     *
     * @param schema the dataset schema
     * @return the catalog
     */
    public static DimensionCatalog fromSchema(Schema schema) {
        Map<String, DimensionDescriptor> dimensions = new LinkedHashMap<>();
        for (SchemaField field : schema.fields()) {
            dimensions.put(field.name(),
                new DimensionDescriptor(field.name(), field.dataType(), operatorsFor(field.dataType())));
        }
        return new DimensionCatalog(dimensions);
    }

    /**
     * Describes a dimension.
     *
     * @param name the dimension name
     * @return the descriptor
     * @throws UnknownDimensionException if the name is not registered
     */
    public DimensionDescriptor describe(String name) {
        DimensionDescriptor descriptor = dimensions.get(name);
        if (descriptor == null) {
            throw new UnknownDimensionException(name, dimensions.keySet());
        }
        return descriptor;
    }

    /**
     * Returns the registered dimension names in schema order.
     *
     * @return an unmodifiable list of names
     */
    public List<String> list() {
        return List.copyOf(dimensions.keySet());
    }

    /**
     * Returns the operators legal for a type.
     *
     * @param type the declared type
     * @return the operator set
     */
    public static Set<ComparisonOperator> operatorsFor(DataType type) {
        if (type instanceof NumericType || type instanceof DateType) {
            return NUMERIC_OPERATORS;
        }
        if (type instanceof StringType) {
            return STRING_OPERATORS;
        }
        if (type instanceof BooleanType) {
            return BOOLEAN_OPERATORS;
        }
        throw new IllegalArgumentException("Unsupported type: " + type);
    }

    @Override
    public String toString() {
        return "DimensionCatalog" + dimensions.keySet();
    }
}
