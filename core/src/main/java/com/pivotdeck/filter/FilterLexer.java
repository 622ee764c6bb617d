package com.pivotdeck.filter;

import com.pivotdeck.exception.ParseException;
import com.pivotdeck.filter.Token.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Splits filter text into tokens.
 *
 * <p>Recognized tokens:
 * <ul>
 *   <li>identifiers: {@code [A-Za-z_][A-Za-z0-9_]*}; the words {@code AND}, {@code OR},
 *       {@code contains}, {@code in}, {@code true} and {@code false} are keywords
 *       (case-insensitive)</li>
 *   <li>numbers: optional {@code -}, digits, optional fraction and exponent</li>
 *   <li>strings: single- or double-quoted; a doubled quote inside escapes it</li>
 *   <li>operators: {@code = == != <> > >= < <=}</li>
 *   <li>punctuation: {@code ( ) ,}</li>
 * </ul>
 */
final class FilterLexer {

    private final String text;
    private int pos;

    FilterLexer(String text) {
        this.text = text;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= text.length()) {
                tokens.add(new Token(TokenType.EOF, "", pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        char c = text.charAt(pos);
        int start = pos;

        if (c == '(') {
            pos++;
            return new Token(TokenType.LPAREN, "(", start);
        }
        if (c == ')') {
            pos++;
            return new Token(TokenType.RPAREN, ")", start);
        }
        if (c == ',') {
            pos++;
            return new Token(TokenType.COMMA, ",", start);
        }
        if (c == '\'' || c == '"') {
            return readString(c);
        }
        if (Character.isDigit(c) || (c == '-' && pos + 1 < text.length() && Character.isDigit(text.charAt(pos + 1)))) {
            return readNumber();
        }
        if (Character.isLetter(c) || c == '_') {
            return readWord();
        }
        if (c == '=' || c == '!' || c == '<' || c == '>') {
            return readOperator();
        }
        throw new ParseException("Unexpected character '" + c + "'", start, String.valueOf(c));
    }

    private Token readString(char quote) {
        int start = pos;
        StringBuilder value = new StringBuilder();
        pos++;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == quote) {
                if (pos + 1 < text.length() && text.charAt(pos + 1) == quote) {
                    value.append(quote);
                    pos += 2;
                    continue;
                }
                pos++;
                return new Token(TokenType.STRING, value.toString(), start);
            }
            value.append(c);
            pos++;
        }
        throw new ParseException("Unterminated string literal", start, text.substring(start));
    }

    private Token readNumber() {
        int start = pos;
        if (text.charAt(pos) == '-') {
            pos++;
        }
        consumeDigits();
        if (pos < text.length() && text.charAt(pos) == '.') {
            pos++;
            if (pos >= text.length() || !Character.isDigit(text.charAt(pos))) {
                throw new ParseException("Malformed number", start, text.substring(start, pos));
            }
            consumeDigits();
        }
        if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < text.length() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
                pos++;
            }
            if (pos >= text.length() || !Character.isDigit(text.charAt(pos))) {
                throw new ParseException("Malformed number", start, text.substring(start, Math.max(pos, mark)));
            }
            consumeDigits();
        }
        if (pos < text.length() && (Character.isLetter(text.charAt(pos)) || text.charAt(pos) == '_')) {
            throw new ParseException("Malformed number", start, text.substring(start, pos + 1));
        }
        return new Token(TokenType.NUMBER, text.substring(start, pos), start);
    }

    private Token readWord() {
        int start = pos;
        while (pos < text.length() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
            pos++;
        }
        String word = text.substring(start, pos);
        return switch (word.toLowerCase(Locale.ROOT)) {
            case "and" -> new Token(TokenType.AND, word, start);
            case "or" -> new Token(TokenType.OR, word, start);
            case "contains" -> new Token(TokenType.CONTAINS, word, start);
            case "in" -> new Token(TokenType.IN, word, start);
            case "true", "false" -> new Token(TokenType.BOOLEAN, word.toLowerCase(Locale.ROOT), start);
            default -> new Token(TokenType.IDENTIFIER, word, start);
        };
    }

    private Token readOperator() {
        int start = pos;
        char c = text.charAt(pos);
        char following = pos + 1 < text.length() ? text.charAt(pos + 1) : '\0';
        String symbol;
        if (following == '=' || (c == '<' && following == '>')) {
            symbol = text.substring(pos, pos + 2);
        } else if (c == '!') {
            throw new ParseException("Expected '!='", start, "!");
        } else {
            symbol = String.valueOf(c);
        }
        pos += symbol.length();
        return new Token(TokenType.OPERATOR, symbol, start);
    }

    private void consumeDigits() {
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
            pos++;
        }
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }
}
