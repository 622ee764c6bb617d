package com.pivotdeck.filter;

/**
 * The empty filter: every record matches.
 */
public final class MatchAll implements FilterExpression {

    public static final MatchAll INSTANCE = new MatchAll();

    private MatchAll() {}

    @Override
    public String toFilterString() {
        return "";
    }

    @Override
    public String toString() {
        return "MatchAll";
    }
}
