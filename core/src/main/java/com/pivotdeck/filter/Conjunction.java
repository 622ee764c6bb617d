package com.pivotdeck.filter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * AND node: true iff every child is true.
 */
public final class Conjunction implements FilterExpression {

    private final List<FilterExpression> children;

    /**
     * Creates a conjunction.
     *
     * @param children two or more operands
     */
    public Conjunction(List<FilterExpression> children) {
        Objects.requireNonNull(children, "children must not be null");
        if (children.size() < 2) {
            throw new IllegalArgumentException("AND requires at least two operands");
        }
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    public List<FilterExpression> children() {
        return children;
    }

    @Override
    public String toFilterString() {
        return children.stream()
            .map(child -> child instanceof Disjunction ? "(" + child.toFilterString() + ")" : child.toFilterString())
            .collect(Collectors.joining(" AND "));
    }

    @Override
    public String toString() {
        return toFilterString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Conjunction)) return false;
        return children.equals(((Conjunction) obj).children);
    }

    @Override
    public int hashCode() {
        return Objects.hash("AND", children);
    }
}
