package com.pivotdeck.filter;

import com.pivotdeck.catalog.DimensionCatalog;
import com.pivotdeck.catalog.DimensionDescriptor;
import com.pivotdeck.data.ValueCoercion;
import com.pivotdeck.exception.TypeMismatchException;
import com.pivotdeck.exception.UnknownDimensionException;
import com.pivotdeck.types.BooleanType;
import com.pivotdeck.types.DataType;
import com.pivotdeck.types.DateType;
import com.pivotdeck.types.NumericType;
import com.pivotdeck.types.StringType;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves the dimensions of a parsed filter against the catalog and converts every
 * literal to the dimension's storage type.
 *
 * <p>Accepted literals by type:
 * <ul>
 *   <li>numeric: number literals</li>
 *   <li>string: quoted strings and bare words</li>
 *   <li>date: quoted ISO dates ({@code '2024-01-31'})</li>
 *   <li>boolean: {@code true} / {@code false}</li>
 * </ul>
 */
public final class FilterTypeChecker {

    private FilterTypeChecker() {}

    /**
     * Type checks an expression and returns its bound form.
     *
     * @param expression the parsed expression
     * @param catalog the dimension catalog
     * @return an equivalent tree whose comparisons are bound
     * @throws UnknownDimensionException if a comparison names an unregistered dimension
     * @throws TypeMismatchException if an operator or literal does not fit the dimension type
     */
    public static FilterExpression check(FilterExpression expression, DimensionCatalog catalog) {
        if (expression instanceof Comparison comparison) {
            return bind(comparison, catalog);
        }
        if (expression instanceof Conjunction conjunction) {
            return new Conjunction(checkAll(conjunction.children(), catalog));
        }
        if (expression instanceof Disjunction disjunction) {
            return new Disjunction(checkAll(disjunction.children(), catalog));
        }
        return expression;
    }

    private static List<FilterExpression> checkAll(List<FilterExpression> children, DimensionCatalog catalog) {
        List<FilterExpression> checked = new ArrayList<>(children.size());
        for (FilterExpression child : children) {
            checked.add(check(child, catalog));
        }
        return checked;
    }

    private static Comparison bind(Comparison comparison, DimensionCatalog catalog) {
        DimensionDescriptor descriptor = catalog.describe(comparison.dimension());
        DataType type = descriptor.type();

        if (!descriptor.allows(comparison.operator())) {
            throw new TypeMismatchException(
                "Operator '" + comparison.operator().symbol() + "' is not supported for " + type.typeName() + " fields",
                comparison.dimension(), type, null);
        }

        List<Object> values = new ArrayList<>(comparison.literals().size());
        for (Literal literal : comparison.literals()) {
            values.add(convert(comparison.dimension(), type, literal));
        }
        return comparison.bind(values);
    }

    private static Object convert(String dimension, DataType type, Literal literal) {
        if (!accepts(type, literal.kind())) {
            throw mismatch(dimension, type, literal);
        }
        Object value = ValueCoercion.coerce(literal.text(), type);
        if (value == null) {
            throw mismatch(dimension, type, literal);
        }
        return value;
    }

    private static boolean accepts(DataType type, Literal.Kind kind) {
        if (type instanceof NumericType) {
            return kind == Literal.Kind.NUMBER;
        }
        if (type instanceof StringType) {
            return kind == Literal.Kind.STRING || kind == Literal.Kind.IDENTIFIER;
        }
        if (type instanceof DateType) {
            return kind == Literal.Kind.STRING;
        }
        if (type instanceof BooleanType) {
            return kind == Literal.Kind.BOOLEAN;
        }
        return false;
    }

    private static TypeMismatchException mismatch(String dimension, DataType type, Literal literal) {
        return new TypeMismatchException(
            "Literal " + literal.toFilterString() + " at position " + literal.position() +
                " is not a valid " + type.typeName() + " value",
            dimension, type, literal.text());
    }
}
