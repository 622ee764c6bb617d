package com.pivotdeck.filter;

/**
 * Node of a parsed filter expression.
 *
 * <p>Filter text parses to a tree of {@link Comparison} leaves combined by
 * {@link Conjunction} (AND) and {@link Disjunction} (OR) nodes. {@link MatchAll}
 * stands for the empty filter. Nodes are immutable and carry no evaluation state;
 * evaluation lives in {@link FilterEvaluator}.
 */
public sealed interface FilterExpression
    permits Comparison, Conjunction, Disjunction, MatchAll {

    /**
     * Renders this expression back to filter syntax, with parentheses only where
     * an OR is nested under an AND.
     *
     * @return the filter text
     */
    String toFilterString();
}
