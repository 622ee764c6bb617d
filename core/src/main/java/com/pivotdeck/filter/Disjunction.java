package com.pivotdeck.filter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * OR node: true iff any child is true.
 */
public final class Disjunction implements FilterExpression {

    private final List<FilterExpression> children;

    /**
     * Creates a disjunction.
     *
     * @param children two or more operands
     */
    public Disjunction(List<FilterExpression> children) {
        Objects.requireNonNull(children, "children must not be null");
        if (children.size() < 2) {
            throw new IllegalArgumentException("OR requires at least two operands");
        }
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    public List<FilterExpression> children() {
        return children;
    }

    @Override
    public String toFilterString() {
        return children.stream()
            .map(FilterExpression::toFilterString)
            .collect(Collectors.joining(" OR "));
    }

    @Override
    public String toString() {
        return toFilterString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Disjunction)) return false;
        return children.equals(((Disjunction) obj).children);
    }

    @Override
    public int hashCode() {
        return Objects.hash("OR", children);
    }
}
