package com.pivotdeck.bucket;

import com.pivotdeck.catalog.DimensionCatalog;
import com.pivotdeck.catalog.DimensionDescriptor;
import com.pivotdeck.exception.ConfigurationException;
import com.pivotdeck.types.BooleanType;
import com.pivotdeck.types.DataType;
import com.pivotdeck.types.DateType;
import com.pivotdeck.types.NumericType;
import com.pivotdeck.types.StringType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Validating factory for {@link BucketRule}s and the bucket rule engine entry point.
 *
 * <p>{@link #define} accepts the loosely typed definitions a configuration layer
 * forwards and turns them into validated, immutable rules:
 * <ul>
 *   <li>{@code NUMERIC_RANGE}: a {@code List<NumericRange>}</li>
 *   <li>{@code CATEGORICAL_GROUP}: a {@code Map<String, String>} of value to label</li>
 *   <li>{@code DATE_GRANULARITY}: a {@link DateGranularity} or its name</li>
 * </ul>
 */
public final class BucketRules {

    private BucketRules() {}

    /**
     * Defines and validates a bucket rule.
     *
     * @param dimension the dimension to bucket
     * @param kind the rule kind
     * @param definition the kind-specific definition
     * @return the validated rule
     * @throws ConfigurationException if the definition does not fit the kind or is invalid
     */
    public static BucketRule define(String dimension, BucketKind kind, Object definition) {
        Objects.requireNonNull(dimension, "dimension must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (definition == null) {
            throw new ConfigurationException("Bucket rule definition must not be null", dimension);
        }

        switch (kind) {
            case NUMERIC_RANGE:
                return new NumericRangeRule(dimension, toRanges(dimension, definition));
            case CATEGORICAL_GROUP:
                return new CategoricalGroupRule(dimension, toMapping(dimension, definition));
            case DATE_GRANULARITY:
                if (definition instanceof DateGranularity granularity) {
                    return new DateGranularityRule(dimension, granularity);
                }
                return new DateGranularityRule(dimension, DateGranularity.parse(definition.toString()));
            default:
                throw new ConfigurationException("Unsupported bucket kind: " + kind, dimension);
        }
    }

    public static NumericRangeRule numericRanges(String dimension, NumericRange... ranges) {
        return new NumericRangeRule(dimension, List.of(ranges));
    }

    public static CategoricalGroupRule categorical(String dimension, Map<String, String> mapping) {
        return new CategoricalGroupRule(dimension, mapping);
    }

    public static DateGranularityRule dateGranularity(String dimension, DateGranularity granularity) {
        return new DateGranularityRule(dimension, granularity);
    }

    /**
     * Maps a value to its label. Total: never throws, and a missing value always
     * yields {@link BucketLabels#MISSING}.
     *
     * @param rule the rule
     * @param value the typed value, or null if missing
     * @return the label
     */
    public static String apply(BucketRule rule, Object value) {
        if (value == null) {
            return BucketLabels.MISSING;
        }
        return rule.apply(value);
    }

    /**
     * Checks that a rule targets a registered dimension whose type the rule can bucket.
     *
     * @param rule the rule
     * @param catalog the dimension catalog
     * @throws com.pivotdeck.exception.UnknownDimensionException if the dimension is not registered
     * @throws ConfigurationException if the rule kind does not fit the dimension type
     */
    public static void validateFor(BucketRule rule, DimensionCatalog catalog) {
        DimensionDescriptor descriptor = catalog.describe(rule.dimension());
        if (!supports(rule.kind(), descriptor.type())) {
            throw new ConfigurationException(
                rule.kind() + " rule cannot bucket " + descriptor.type().typeName() + " values", rule.dimension());
        }
    }

    private static boolean supports(BucketKind kind, DataType type) {
        return switch (kind) {
            case NUMERIC_RANGE -> type instanceof NumericType;
            case CATEGORICAL_GROUP -> type instanceof StringType || type instanceof BooleanType;
            case DATE_GRANULARITY -> type instanceof DateType;
        };
    }

    private static List<NumericRange> toRanges(String dimension, Object definition) {
        if (!(definition instanceof List<?> list)) {
            throw new ConfigurationException("Numeric range definition must be a list of ranges", dimension);
        }
        List<NumericRange> ranges = new ArrayList<>(list.size());
        for (Object item : list) {
            if (!(item instanceof NumericRange range)) {
                throw new ConfigurationException("Not a numeric range: " + item, dimension);
            }
            ranges.add(range);
        }
        return ranges;
    }

    private static Map<String, String> toMapping(String dimension, Object definition) {
        if (!(definition instanceof Map<?, ?> map)) {
            throw new ConfigurationException("Categorical group definition must be a value-to-label map", dimension);
        }
        Map<String, String> mapping = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                throw new ConfigurationException("Mapping entries need a value and a label: " + entry, dimension);
            }
            mapping.put(entry.getKey().toString(), entry.getValue().toString());
        }
        return mapping;
    }
}
