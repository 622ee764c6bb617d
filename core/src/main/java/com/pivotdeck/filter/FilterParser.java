package com.pivotdeck.filter;

import com.pivotdeck.exception.ParseException;
import com.pivotdeck.filter.Token.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for filter text.
 *
 * <p>Grammar (AND binds tighter than OR; parentheses override):
 * <pre>
 *   expr       := term (OR term)*
 *   term       := factor (AND factor)*
 *   factor     := '(' expr ')' | comparison
 *   comparison := dimension operator literal
 *               | dimension 'in' '(' literal (',' literal)* ')'
 *   operator   := '=' | '!=' | '>' | '>=' | '<' | '<=' | 'contains'
 * </pre>
 *
 * <p>The parser only checks syntax. Dimension names and literal types are checked
 * afterwards by {@link FilterTypeChecker}. Blank text parses to {@link MatchAll}.
 *
 * <p>Examples:
 * <pre>
 *   age > 25 AND ltv < 30
 *   country = 'US' OR (device_type = Mobile AND email_subscriber = true)
 *   loyalty_tier in ('Gold', 'Platinum')
 * </pre>
 */
public final class FilterParser {

    private static final Logger logger = LoggerFactory.getLogger(FilterParser.class);

    /** Deepest parenthesis nesting accepted */
    static final int MAX_NESTING_DEPTH = 64;

    private final List<Token> tokens;
    private int index;
    private int depth;

    private FilterParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses filter text into an unbound expression tree.
     *
     * @param text the filter text (null or blank means match all)
     * @return the expression
     * @throws ParseException if the text is malformed
     */
    public static FilterExpression parse(String text) {
        if (text == null || text.isBlank()) {
            return MatchAll.INSTANCE;
        }
        logger.debug("Parsing filter: {}", text);

        FilterParser parser = new FilterParser(new FilterLexer(text).tokenize());
        FilterExpression expression = parser.parseExpression();
        Token trailing = parser.peek();
        if (!trailing.is(TokenType.EOF)) {
            throw new ParseException("Unexpected '" + trailing.text() + "'", trailing.position(), trailing.text());
        }
        return expression;
    }

    private FilterExpression parseExpression() {
        List<FilterExpression> terms = new ArrayList<>();
        terms.add(parseTerm());
        while (peek().is(TokenType.OR)) {
            advance();
            terms.add(parseTerm());
        }
        return terms.size() == 1 ? terms.get(0) : new Disjunction(terms);
    }

    private FilterExpression parseTerm() {
        List<FilterExpression> factors = new ArrayList<>();
        factors.add(parseFactor());
        while (peek().is(TokenType.AND)) {
            advance();
            factors.add(parseFactor());
        }
        return factors.size() == 1 ? factors.get(0) : new Conjunction(factors);
    }

    private FilterExpression parseFactor() {
        if (peek().is(TokenType.LPAREN)) {
            Token open = advance();
            if (++depth > MAX_NESTING_DEPTH) {
                throw new ParseException("Expression nested too deeply (more than " + MAX_NESTING_DEPTH
                    + " levels)", open.position(), open.text());
            }
            FilterExpression inner = parseExpression();
            expect(TokenType.RPAREN, "Expected ')'");
            depth--;
            return inner;
        }
        return parseComparison();
    }

    private Comparison parseComparison() {
        Token dimension = expect(TokenType.IDENTIFIER, "Expected a dimension name");
        Token operatorToken = advance();

        ComparisonOperator operator;
        switch (operatorToken.type()) {
            case OPERATOR:
                operator = ComparisonOperator.fromSymbol(operatorToken.text())
                    .orElseThrow(() -> new ParseException("Unknown operator '" + operatorToken.text() + "'",
                        operatorToken.position(), operatorToken.text()));
                break;
            case CONTAINS:
                operator = ComparisonOperator.CONTAINS;
                break;
            case IN:
                return new Comparison(dimension.text(), ComparisonOperator.IN, parseLiteralList(), dimension.position());
            default:
                throw new ParseException("Expected an operator after '" + dimension.text() + "'",
                    operatorToken.position(), operatorToken.display());
        }

        return new Comparison(dimension.text(), operator, List.of(parseLiteral()), dimension.position());
    }

    private List<Literal> parseLiteralList() {
        expect(TokenType.LPAREN, "Expected '(' after 'in'");
        List<Literal> literals = new ArrayList<>();
        literals.add(parseLiteral());
        while (peek().is(TokenType.COMMA)) {
            advance();
            literals.add(parseLiteral());
        }
        expect(TokenType.RPAREN, "Expected ',' or ')' in value list");
        return literals;
    }

    private Literal parseLiteral() {
        Token token = advance();
        return switch (token.type()) {
            case NUMBER -> new Literal(Literal.Kind.NUMBER, token.text(), token.position());
            case STRING -> new Literal(Literal.Kind.STRING, token.text(), token.position());
            case IDENTIFIER -> new Literal(Literal.Kind.IDENTIFIER, token.text(), token.position());
            case BOOLEAN -> new Literal(Literal.Kind.BOOLEAN, token.text(), token.position());
            default -> throw new ParseException("Expected a value", token.position(), token.display());
        };
    }

    private Token expect(TokenType type, String message) {
        Token token = advance();
        if (!token.is(type)) {
            throw new ParseException(message, token.position(), token.display());
        }
        return token;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token advance() {
        Token token = tokens.get(index);
        if (!token.is(TokenType.EOF)) {
            index++;
        }
        return token;
    }
}
