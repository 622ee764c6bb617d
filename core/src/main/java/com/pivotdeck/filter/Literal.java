package com.pivotdeck.filter;

import java.util.Objects;

/**
 * A literal as written in filter text, before it is checked against a dimension type.
 *
 * @param kind the lexical kind
 * @param text the literal text (unquoted for strings)
 * @param position the 0-based offset in the filter text
 */
public record Literal(Kind kind, String text, int position) {

    public enum Kind {
        NUMBER,
        STRING,
        /** A bare word on the literal side, read as text. */
        IDENTIFIER,
        BOOLEAN
    }

    public Literal {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    /**
     * Renders the literal back to filter syntax.
     *
     * @return the literal text, quoted if it is a string
     */
    public String toFilterString() {
        if (kind == Kind.STRING) {
            return "'" + text.replace("'", "''") + "'";
        }
        return text;
    }

    @Override
    public String toString() {
        return toFilterString();
    }
}
