package com.pivotdeck.filter;

import java.util.Locale;
import java.util.Optional;

/**
 * Comparison operators of the filter language.
 */
public enum ComparisonOperator {
    EQUAL("=", "equal"),
    NOT_EQUAL("!=", "not equal"),
    GREATER_THAN(">", "greater than"),
    GREATER_THAN_OR_EQUAL(">=", "greater than or equal"),
    LESS_THAN("<", "less than"),
    LESS_THAN_OR_EQUAL("<=", "less than or equal"),
    CONTAINS("contains", "substring match"),
    IN("in", "membership in a literal list");

    private final String symbol;
    private final String description;

    ComparisonOperator(String symbol, String description) {
        this.symbol = symbol;
        this.description = description;
    }

    public String symbol() {
        return symbol;
    }

    public String description() {
        return description;
    }

    public boolean isOrdering() {
        return this == GREATER_THAN || this == GREATER_THAN_OR_EQUAL ||
               this == LESS_THAN || this == LESS_THAN_OR_EQUAL;
    }

    /**
     * Looks up an operator by its symbol or keyword (case-insensitive).
     *
     * @param symbol the operator text as written in a filter
     * @return the operator, or empty if not recognized
     */
    public static Optional<ComparisonOperator> fromSymbol(String symbol) {
        String normalized = symbol.toLowerCase(Locale.ROOT);
        if (normalized.equals("==")) {
            return Optional.of(EQUAL);
        }
        if (normalized.equals("<>")) {
            return Optional.of(NOT_EQUAL);
        }
        for (ComparisonOperator op : values()) {
            if (op.symbol.equals(normalized)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return symbol;
    }
}
