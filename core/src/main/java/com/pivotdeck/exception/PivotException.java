package com.pivotdeck.exception;

/**
 * Base class for every error raised by the pivot engine.
 *
 * <p>All engine errors are unchecked and structured: subclasses carry the offending
 * dimension, token or metric so that a rendering layer can highlight the exact
 * misconfiguration instead of showing a raw stack trace.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       Filter filter = engine.parseFilter(text, dataset.schema());
 *   } catch (PivotException e) {
 *       showError(e.getUserMessage());
 *   }
 * </pre>
 */
public abstract class PivotException extends RuntimeException {

    protected PivotException(String message) {
        super(message);
    }

    protected PivotException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns a message suitable for display to an analyst.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        return getMessage();
    }
}
