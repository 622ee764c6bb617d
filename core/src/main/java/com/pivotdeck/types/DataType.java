package com.pivotdeck.types;

/**
 * Sealed interface for the declared types of record dimensions.
 *
 * <p>Every dimension in a {@link Schema} carries exactly one of these types. The
 * type decides which values a dimension may hold, which filter operators are legal
 * against it and which bucket rules can be applied to it:
 * <ul>
 *   <li>{@link NumericType}: numeric measures (age, revenue, scores)</li>
 *   <li>{@link StringType}: categorical or free text values (country, tier)</li>
 *   <li>{@link DateType}: calendar dates without time of day</li>
 *   <li>{@link BooleanType}: flags (subscriber, churned)</li>
 * </ul>
 */
public sealed interface DataType
    permits NumericType, StringType, DateType, BooleanType {

    /**
     * Returns a human-readable name for this data type.
     *
     * @return the type name
     */
    String typeName();
}
