package com.pivotdeck.filter;

/**
 * A lexical token of filter text with its 0-based start offset.
 */
record Token(TokenType type, String text, int position) {

    enum TokenType {
        IDENTIFIER,
        NUMBER,
        STRING,
        BOOLEAN,
        OPERATOR,
        AND,
        OR,
        CONTAINS,
        IN,
        LPAREN,
        RPAREN,
        COMMA,
        EOF
    }

    boolean is(TokenType expected) {
        return type == expected;
    }

    /** Text for error messages; empty at end of input. */
    String display() {
        return type == TokenType.EOF ? "" : text;
    }
}
