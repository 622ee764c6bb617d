package com.pivotdeck.config;

import com.pivotdeck.exception.ConfigurationException;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Properties;

/**
 * Engine settings read from system properties.
 *
 * <p>Properties:
 * <ul>
 *   <li>{@code pivotdeck.generator.seed}: seed of the synthetic data generator (default 42)</li>
 *   <li>{@code pivotdeck.generator.count}: number of generated users (default 5000)</li>
 *   <li>{@code pivotdeck.generator.referenceDate}: the "today" of generated data, ISO date
 *       (default 2025-01-01)</li>
 *   <li>{@code pivotdeck.result.scale}: decimals of serialized results, -1 for unrounded
 *       (default -1)</li>
 *   <li>{@code pivotdeck.session.threads}: worker threads for asynchronous pivot
 *       recomputation (default 2)</li>
 * </ul>
 *
 * <p>Unlike unset properties, malformed values are rejected rather than replaced by
 * the default.
 */
public final class PivotDeckConfig {

    /** System property for the generator seed */
    public static final String PROP_GENERATOR_SEED = "pivotdeck.generator.seed";

    /** System property for the generated user count */
    public static final String PROP_GENERATOR_COUNT = "pivotdeck.generator.count";

    /** System property for the generator reference date */
    public static final String PROP_GENERATOR_REFERENCE_DATE = "pivotdeck.generator.referenceDate";

    /** System property for the result display scale */
    public static final String PROP_RESULT_SCALE = "pivotdeck.result.scale";

    /** System property for the session worker thread count */
    public static final String PROP_SESSION_THREADS = "pivotdeck.session.threads";

    public static final long DEFAULT_GENERATOR_SEED = 42L;
    public static final int DEFAULT_GENERATOR_COUNT = 5000;
    public static final LocalDate DEFAULT_REFERENCE_DATE = LocalDate.of(2025, 1, 1);
    public static final int DEFAULT_RESULT_SCALE = -1;
    public static final int DEFAULT_SESSION_THREADS = 2;

    private final long generatorSeed;
    private final int generatorCount;
    private final LocalDate referenceDate;
    private final int resultScale;
    private final int sessionThreads;

    public PivotDeckConfig(long generatorSeed, int generatorCount, LocalDate referenceDate,
                           int resultScale, int sessionThreads) {
        if (generatorCount < 0) {
            throw new ConfigurationException("Generator count must not be negative: " + generatorCount,
                PROP_GENERATOR_COUNT);
        }
        if (resultScale < -1) {
            throw new ConfigurationException("Result scale must be -1 or a non-negative number of decimals: "
                + resultScale, PROP_RESULT_SCALE);
        }
        if (sessionThreads < 1) {
            throw new ConfigurationException("Session threads must be positive: " + sessionThreads,
                PROP_SESSION_THREADS);
        }
        this.generatorSeed = generatorSeed;
        this.generatorCount = generatorCount;
        this.referenceDate = Objects.requireNonNull(referenceDate, "referenceDate must not be null");
        this.resultScale = resultScale;
        this.sessionThreads = sessionThreads;
    }

    public static PivotDeckConfig defaults() {
        return new PivotDeckConfig(DEFAULT_GENERATOR_SEED, DEFAULT_GENERATOR_COUNT,
            DEFAULT_REFERENCE_DATE, DEFAULT_RESULT_SCALE, DEFAULT_SESSION_THREADS);
    }

    /**
     * Reads the configuration from {@link System#getProperties()}.
     *
     * @return the configuration
     * @throws ConfigurationException if a property is set to an invalid value
     */
    public static PivotDeckConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Reads the configuration from a property set; unset keys take their defaults.
     *
     * @param properties the properties
     * @return the configuration
     * @throws ConfigurationException if a property is set to an invalid value
     */
    public static PivotDeckConfig fromProperties(Properties properties) {
        return new PivotDeckConfig(
            parseLong(properties, PROP_GENERATOR_SEED, DEFAULT_GENERATOR_SEED),
            parseInt(properties, PROP_GENERATOR_COUNT, DEFAULT_GENERATOR_COUNT),
            parseDate(properties, PROP_GENERATOR_REFERENCE_DATE, DEFAULT_REFERENCE_DATE),
            parseInt(properties, PROP_RESULT_SCALE, DEFAULT_RESULT_SCALE),
            parseInt(properties, PROP_SESSION_THREADS, DEFAULT_SESSION_THREADS));
    }

    public long generatorSeed() {
        return generatorSeed;
    }

    public int generatorCount() {
        return generatorCount;
    }

    public LocalDate referenceDate() {
        return referenceDate;
    }

    public int resultScale() {
        return resultScale;
    }

    public int sessionThreads() {
        return sessionThreads;
    }

    private static long parseLong(Properties properties, String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Not a number: '" + value + "'", key, e);
        }
    }

    private static int parseInt(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Not a number: '" + value + "'", key, e);
        }
    }

    private static LocalDate parseDate(Properties properties, String key, LocalDate defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("Not an ISO date: '" + value + "'", key, e);
        }
    }

    @Override
    public String toString() {
        return String.format("PivotDeckConfig[seed=%d, count=%d, referenceDate=%s, scale=%d, threads=%d]",
            generatorSeed, generatorCount, referenceDate, resultScale, sessionThreads);
    }
}
