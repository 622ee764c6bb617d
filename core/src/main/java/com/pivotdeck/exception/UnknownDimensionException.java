package com.pivotdeck.exception;

import java.util.Collection;
import java.util.List;

/**
 * Exception thrown when a dimension name is not registered in the dimension catalog.
 */
public class UnknownDimensionException extends PivotException {

    private final String dimension;
    private final List<String> available;

    /**
     * Creates an unknown dimension exception.
     *
     * @param dimension the unregistered name
     * @param available the registered dimension names, for suggestions
     */
    public UnknownDimensionException(String dimension, Collection<String> available) {
        super("Unknown dimension: " + dimension);
        this.dimension = dimension;
        this.available = List.copyOf(available);
    }

    public String getDimension() {
        return dimension;
    }

    public List<String> getAvailable() {
        return available;
    }

    @Override
    public String getUserMessage() {
        if (available.isEmpty()) {
            return "Dimension '" + dimension + "' not found.";
        }
        return "Dimension '" + dimension + "' not found. Available dimensions: " +
               String.join(", ", available);
    }
}
