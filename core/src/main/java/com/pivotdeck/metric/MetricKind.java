package com.pivotdeck.metric;

/**
 * The fixed set of aggregation kinds.
 */
public enum MetricKind {
    COUNT(0),
    SUM(1),
    MEAN(1),
    DISTINCT_COUNT(1),
    /** Quotient of two other metrics, named by its two source fields. */
    RATIO(2);

    private final int arity;

    MetricKind(int arity) {
        this.arity = arity;
    }

    /**
     * Returns the number of source fields this kind takes.
     *
     * @return 0 for count, 2 for ratio, otherwise 1
     */
    public int arity() {
        return arity;
    }
}
