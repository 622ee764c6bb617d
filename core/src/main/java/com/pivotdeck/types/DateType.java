package com.pivotdeck.types;

import java.time.LocalDate;

/**
 * Data type representing a calendar date (year, month, day) without time information.
 *
 * <p>Stored as {@link LocalDate}; timestamps are truncated to their date on load.
 */
public final class DateType implements DataType {

    private static final DateType INSTANCE = new DateType();

    private DateType() {}

    public static DateType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "date";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof DateType;
    }

    @Override
    public int hashCode() {
        return typeName().hashCode();
    }

    @Override
    public String toString() {
        return typeName();
    }
}
