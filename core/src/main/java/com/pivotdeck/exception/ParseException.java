package com.pivotdeck.exception;

/**
 * Exception thrown when filter text is malformed.
 *
 * <p>Carries the 0-based character position of the offending token so the caller can
 * point at it, e.g. for {@code age > AND ltv < 30} the position is 6 and the token
 * is {@code AND}.
 */
public class ParseException extends PivotException {

    private final int position;
    private final String token;

    /**
     * Creates a parse exception.
     *
     * @param message the error message
     * @param position the 0-based character offset of the offending token
     * @param token the offending token text (empty at end of input)
     */
    public ParseException(String message, int position, String token) {
        super(message + " at position " + position);
        this.position = position;
        this.token = token;
    }

    public int getPosition() {
        return position;
    }

    public String getToken() {
        return token;
    }

    @Override
    public String getUserMessage() {
        if (token == null || token.isEmpty()) {
            return "Filter is incomplete: " + getMessage();
        }
        return "Filter could not be parsed near '" + token + "': " + getMessage();
    }
}
