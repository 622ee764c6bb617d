package com.pivotdeck.exception;

/**
 * Exception thrown when a bucket rule, pivot spec, schema or engine setting is invalid.
 *
 * <p>Common causes:
 * <ul>
 *   <li>Numeric ranges declared out of order or overlapping</li>
 *   <li>A bucket rule whose kind does not fit the dimension's type</li>
 *   <li>Malformed schema text or custom bucket edges</li>
 *   <li>An unparseable configuration property</li>
 * </ul>
 */
public class ConfigurationException extends PivotException {

    private final String subject;

    /**
     * Creates a configuration exception.
     *
     * @param message the error message
     * @param subject the dimension, property or rule that is misconfigured (may be null)
     */
    public ConfigurationException(String message, String subject) {
        super(message);
        this.subject = subject;
    }

    public ConfigurationException(String message, String subject, Throwable cause) {
        super(message, cause);
        this.subject = subject;
    }

    /**
     * Returns the name of the misconfigured element.
     *
     * @return the subject, or null if not tied to a single element
     */
    public String getSubject() {
        return subject;
    }

    @Override
    public String getUserMessage() {
        if (subject == null) {
            return "Invalid configuration: " + getMessage();
        }
        return "Invalid configuration for '" + subject + "': " + getMessage();
    }
}
