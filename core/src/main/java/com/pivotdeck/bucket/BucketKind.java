package com.pivotdeck.bucket;

/**
 * The three families of bucket rules.
 */
public enum BucketKind {
    /** Ordered half-open numeric intervals, each with a label. */
    NUMERIC_RANGE,
    /** Explicit value-to-label mapping for categorical dimensions. */
    CATEGORICAL_GROUP,
    /** Calendar truncation of dates (year, quarter, month, ISO week). */
    DATE_GRANULARITY
}
