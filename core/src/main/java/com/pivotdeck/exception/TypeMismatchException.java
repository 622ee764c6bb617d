package com.pivotdeck.exception;

import com.pivotdeck.types.DataType;

/**
 * Exception thrown when a value or literal does not fit a dimension's declared type.
 *
 * <p>Raised while checking filter literals against the dimension catalog, while
 * validating metric source fields and while loading records into a dataset.
 */
public class TypeMismatchException extends PivotException {

    private final String dimension;
    private final DataType expectedType;
    private final String offendingValue;

    /**
     * Creates a type mismatch exception.
     *
     * @param message the error message
     * @param dimension the dimension whose type was violated
     * @param expectedType the declared type of the dimension
     * @param offendingValue the literal or value that did not fit (may be null)
     */
    public TypeMismatchException(String message, String dimension, DataType expectedType,
                                 String offendingValue) {
        super(message);
        this.dimension = dimension;
        this.expectedType = expectedType;
        this.offendingValue = offendingValue;
    }

    public String getDimension() {
        return dimension;
    }

    public DataType getExpectedType() {
        return expectedType;
    }

    public String getOffendingValue() {
        return offendingValue;
    }

    @Override
    public String getUserMessage() {
        if (offendingValue == null) {
            return "'" + dimension + "' is a " + expectedType.typeName() + " field: " + getMessage();
        }
        return "Value '" + offendingValue + "' does not fit " + expectedType.typeName() +
               " field '" + dimension + "'";
    }
}
