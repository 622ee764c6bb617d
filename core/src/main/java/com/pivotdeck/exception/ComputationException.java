package com.pivotdeck.exception;

/**
 * Exception thrown when metrics cannot be computed as configured.
 *
 * <p>Common causes:
 * <ul>
 *   <li>Cyclic ratio definitions (a ratio that depends on itself)</li>
 *   <li>A ratio referencing a metric that is neither requested nor registered</li>
 *   <li>A pivot request with no metrics</li>
 * </ul>
 */
public class ComputationException extends PivotException {

    private final String metric;

    /**
     * Creates a computation exception.
     *
     * @param message the error message
     * @param metric the metric that could not be resolved (may be null)
     */
    public ComputationException(String message, String metric) {
        super(message);
        this.metric = metric;
    }

    public String getMetric() {
        return metric;
    }

    @Override
    public String getUserMessage() {
        if (metric == null) {
            return "Cannot compute pivot: " + getMessage();
        }
        return "Cannot compute metric '" + metric + "': " + getMessage();
    }
}
