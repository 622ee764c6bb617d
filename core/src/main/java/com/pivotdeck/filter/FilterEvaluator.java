package com.pivotdeck.filter;

import com.pivotdeck.data.Record;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates bound filter expressions against records.
 *
 * <p>Missing values follow one rule everywhere: a comparison against a missing
 * field is false, except {@code !=}, which is true (a missing value differs from
 * every literal). Evaluation is pure; it never modifies records.
 */
public final class FilterEvaluator {

    private FilterEvaluator() {}

    /**
     * Tests one record.
     *
     * @param expression a bound expression
     * @param record the record
     * @return true if the record matches
     * @throws IllegalStateException if the expression contains an unbound comparison
     */
    public static boolean matches(FilterExpression expression, Record record) {
        if (expression instanceof Comparison comparison) {
            return compare(comparison, record.get(comparison.dimension()));
        }
        if (expression instanceof Conjunction conjunction) {
            for (FilterExpression child : conjunction.children()) {
                if (!matches(child, record)) {
                    return false;
                }
            }
            return true;
        }
        if (expression instanceof Disjunction disjunction) {
            for (FilterExpression child : disjunction.children()) {
                if (matches(child, record)) {
                    return true;
                }
            }
            return false;
        }
        return true;
    }

    /**
     * Returns the matching records, in their original order.
     *
     * @param expression a bound expression
     * @param records the records to scan
     * @return a new list of matching records
     */
    public static List<Record> select(FilterExpression expression, List<Record> records) {
        if (expression instanceof MatchAll) {
            return new ArrayList<>(records);
        }
        List<Record> selected = new ArrayList<>();
        for (Record record : records) {
            if (matches(expression, record)) {
                selected.add(record);
            }
        }
        return selected;
    }

    private static boolean compare(Comparison comparison, Object value) {
        List<Object> literals = comparison.values();
        if (value == null) {
            return comparison.operator() == ComparisonOperator.NOT_EQUAL;
        }

        Object literal = literals.get(0);
        switch (comparison.operator()) {
            case EQUAL:
                return valueEquals(value, literal);
            case NOT_EQUAL:
                return !valueEquals(value, literal);
            case GREATER_THAN:
            case GREATER_THAN_OR_EQUAL:
            case LESS_THAN:
            case LESS_THAN_OR_EQUAL:
                return ordered(comparison.operator(), value, literal);
            case CONTAINS:
                return value.toString().contains(literal.toString());
            case IN:
                for (Object candidate : literals) {
                    if (valueEquals(value, candidate)) {
                        return true;
                    }
                }
                return false;
            default:
                throw new IllegalStateException("Unhandled operator: " + comparison.operator());
        }
    }

    private static boolean valueEquals(Object value, Object literal) {
        if (value instanceof Double d && literal instanceof Double l) {
            return d.doubleValue() == l.doubleValue();
        }
        return value.equals(literal);
    }

    /**
     * Doubles use primitive comparison, the same as {@code NumericRange.contains}, so
     * {@code -0.0} equals {@code 0.0}. Dates compare chronologically.
     */
    @SuppressWarnings("unchecked")
    private static boolean ordered(ComparisonOperator operator, Object value, Object literal) {
        if (value instanceof Double d && literal instanceof Double l) {
            double v = d;
            double x = l;
            switch (operator) {
                case GREATER_THAN:
                    return v > x;
                case GREATER_THAN_OR_EQUAL:
                    return v >= x;
                case LESS_THAN:
                    return v < x;
                default:
                    return v <= x;
            }
        }
        int c = ((Comparable<Object>) value).compareTo(literal);
        switch (operator) {
            case GREATER_THAN:
                return c > 0;
            case GREATER_THAN_OR_EQUAL:
                return c >= 0;
            case LESS_THAN:
                return c < 0;
            default:
                return c <= 0;
        }
    }
}
