package com.pivotdeck.bucket;

import com.pivotdeck.exception.ConfigurationException;

import java.time.LocalDate;
import java.time.temporal.IsoFields;
import java.util.Locale;

/**
 * Calendar units a date can be truncated to.
 *
 * <p>All units use the ISO-8601 calendar. Labels are zero-padded so that their
 * lexicographic order is chronological:
 * <ul>
 *   <li>{@code YEAR}: {@code 2024}</li>
 *   <li>{@code QUARTER}: {@code 2024-Q1}</li>
 *   <li>{@code MONTH}: {@code 2024-03}</li>
 *   <li>{@code WEEK}: {@code 2024-W05}, using the ISO week-based year, so
 *       2024-12-30 is {@code 2025-W01}</li>
 * </ul>
 */
public enum DateGranularity {
    YEAR {
        @Override
        public String label(LocalDate date) {
            return String.format("%04d", date.getYear());
        }
    },
    QUARTER {
        @Override
        public String label(LocalDate date) {
            return String.format("%04d-Q%d", date.getYear(), date.get(IsoFields.QUARTER_OF_YEAR));
        }
    },
    MONTH {
        @Override
        public String label(LocalDate date) {
            return String.format("%04d-%02d", date.getYear(), date.getMonthValue());
        }
    },
    WEEK {
        @Override
        public String label(LocalDate date) {
            return String.format("%04d-W%02d",
                date.get(IsoFields.WEEK_BASED_YEAR), date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
        }
    };

    /**
     * Returns the label of the unit containing {@code date}.
     *
     * @param date the date
     * @return the unit label
     */
    public abstract String label(LocalDate date);

    /**
     * Parses a granularity name (case-insensitive).
     *
     * @param value "year", "quarter", "month" or "week"
     * @return the granularity
     * @throws ConfigurationException if the name is not recognized
     */
    public static DateGranularity parse(String value) {
        if (value == null) {
            throw new ConfigurationException("Date granularity must not be null", null);
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "year" -> YEAR;
            case "quarter" -> QUARTER;
            case "month" -> MONTH;
            case "week" -> WEEK;
            default -> throw new ConfigurationException(
                "Unknown date granularity: '%s'. Valid values: year, quarter, month, week".formatted(value), value);
        };
    }
}
