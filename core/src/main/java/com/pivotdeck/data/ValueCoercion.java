package com.pivotdeck.data;

import com.pivotdeck.types.BooleanType;
import com.pivotdeck.types.DataType;
import com.pivotdeck.types.DateType;
import com.pivotdeck.types.NumericType;
import com.pivotdeck.types.StringType;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Converts raw values produced by collaborators into the storage class of a declared type.
 *
 * <p>Conversions:
 * <ul>
 *   <li>numeric: any {@link Number}, or numeric text, becomes a finite {@code Double};
 *       NaN and infinities are rejected and {@code -0.0} is stored as {@code 0.0}</li>
 *   <li>string: any {@link CharSequence}, or an enum constant, becomes a {@code String}</li>
 *   <li>date: {@link LocalDate}, {@link LocalDateTime}, {@link Instant} (UTC) or ISO text
 *       ({@code 2024-03-01} or {@code 2024-03-01T10:15:00}) becomes a {@code LocalDate}</li>
 *   <li>boolean: {@link Boolean} or the text {@code true}/{@code false} becomes a {@code Boolean}</li>
 * </ul>
 */
public final class ValueCoercion {

    private ValueCoercion() {}

    /**
     * Coerces a raw value to the storage class of {@code type}.
     *
     * @param value the raw value (not null)
     * @param type the declared type
     * @return the coerced value, or null if the value cannot be represented as {@code type}
     */
    public static Object coerce(Object value, DataType type) {
        if (type instanceof NumericType) {
            return toDouble(value);
        }
        if (type instanceof StringType) {
            if (value instanceof CharSequence || value instanceof Enum<?>) {
                return value.toString();
            }
            return null;
        }
        if (type instanceof DateType) {
            return toDate(value);
        }
        if (type instanceof BooleanType) {
            return toBoolean(value);
        }
        return null;
    }

    private static Double toDouble(Object value) {
        if (value instanceof Number number) {
            return finite(number.doubleValue());
        }
        if (value instanceof CharSequence text) {
            try {
                return finite(Double.parseDouble(text.toString().trim()));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    // Adding 0.0 turns -0.0 into 0.0
    private static Double finite(double d) {
        return Double.isFinite(d) ? d + 0.0 : null;
    }

    private static LocalDate toDate(Object value) {
        if (value instanceof LocalDate date) {
            return date;
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (value instanceof Instant instant) {
            return LocalDate.ofInstant(instant, ZoneOffset.UTC);
        }
        if (value instanceof CharSequence text) {
            String s = text.toString().trim();
            try {
                if (s.length() > 10) {
                    return LocalDateTime.parse(s.replace(' ', 'T')).toLocalDate();
                }
                return LocalDate.parse(s);
            } catch (DateTimeParseException e) {
                return null;
            }
        }
        return null;
    }

    private static Boolean toBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof CharSequence text) {
            String s = text.toString().trim().toLowerCase(Locale.ROOT);
            if (s.equals("true")) return Boolean.TRUE;
            if (s.equals("false")) return Boolean.FALSE;
        }
        return null;
    }
}
