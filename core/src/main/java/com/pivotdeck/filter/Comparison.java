package com.pivotdeck.filter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Leaf of a filter expression: {@code dimension operator literal}.
 *
 * <p>A comparison is created <em>unbound</em> by the parser, holding only the literal
 * text. {@link FilterTypeChecker} produces a <em>bound</em> copy that also holds the
 * literals converted to the dimension's storage type; only bound comparisons can be
 * evaluated. For {@code in}, there is one literal per list element; every other
 * operator has exactly one literal.
 */
public final class Comparison implements FilterExpression {

    private final String dimension;
    private final ComparisonOperator operator;
    private final List<Literal> literals;
    private final List<Object> values;
    private final int position;

    /**
     * Creates an unbound comparison.
     *
     * @param dimension the dimension name
     * @param operator the operator
     * @param literals the literal(s), one unless the operator is {@code in}
     * @param position the 0-based offset of the dimension name in the filter text
     */
    public Comparison(String dimension, ComparisonOperator operator, List<Literal> literals, int position) {
        this(dimension, operator, literals, null, position);
    }

    private Comparison(String dimension, ComparisonOperator operator, List<Literal> literals,
                       List<Object> values, int position) {
        this.dimension = Objects.requireNonNull(dimension, "dimension must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(literals, "literals must not be null");
        if (literals.isEmpty()) {
            throw new IllegalArgumentException("Comparison requires at least one literal");
        }
        if (operator != ComparisonOperator.IN && literals.size() != 1) {
            throw new IllegalArgumentException(operator + " takes exactly one literal");
        }
        this.literals = Collections.unmodifiableList(new ArrayList<>(literals));
        this.values = values == null ? null : Collections.unmodifiableList(new ArrayList<>(values));
        this.position = position;
    }

    /**
     * Returns a bound copy of this comparison.
     *
     * @param typedValues the literals converted to the dimension's storage type
     * @return the bound comparison
     */
    Comparison bind(List<Object> typedValues) {
        if (typedValues.size() != literals.size()) {
            throw new IllegalArgumentException("Expected " + literals.size() + " values, got " + typedValues.size());
        }
        return new Comparison(dimension, operator, literals, typedValues, position);
    }

    public String dimension() {
        return dimension;
    }

    public ComparisonOperator operator() {
        return operator;
    }

    public List<Literal> literals() {
        return literals;
    }

    public int position() {
        return position;
    }

    public boolean isBound() {
        return values != null;
    }

    /**
     * Returns the typed literal values.
     *
     * @return the values
     * @throws IllegalStateException if this comparison has not been type checked
     */
    public List<Object> values() {
        if (values == null) {
            throw new IllegalStateException("Comparison on '" + dimension + "' has not been type checked");
        }
        return values;
    }

    @Override
    public String toFilterString() {
        if (operator == ComparisonOperator.IN) {
            return dimension + " in (" +
                literals.stream().map(Literal::toFilterString).collect(Collectors.joining(", ")) + ")";
        }
        return dimension + " " + operator.symbol() + " " + literals.get(0).toFilterString();
    }

    @Override
    public String toString() {
        return toFilterString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Comparison)) return false;
        Comparison that = (Comparison) obj;
        return dimension.equals(that.dimension) &&
               operator == that.operator &&
               literals.equals(that.literals) &&
               Objects.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dimension, operator, literals, values);
    }
}
