package com.pivotdeck.bucket;

import java.time.LocalDate;
import java.util.List;

/**
 * Reserved bucket labels and the label used for dimensions that are not bucketed.
 *
 * <p>Reserved labels always sort after the declared labels of a rule, in the order
 * {@link #UNSPECIFIED}, {@link #OTHER}, {@link #MISSING}.
 */
public final class BucketLabels {

    /** Label for a numeric value outside every declared range. */
    public static final String UNSPECIFIED = "Unspecified";

    /** Label for a categorical value with no mapping. */
    public static final String OTHER = "Other";

    /** Label for a missing value, under any rule and for unbucketed dimensions. */
    public static final String MISSING = "Missing";

    private static final List<String> RESERVED = List.of(UNSPECIFIED, OTHER, MISSING);

    private BucketLabels() {}

    public static boolean isReserved(String label) {
        return RESERVED.contains(label);
    }

    /**
     * Returns the sort rank of a reserved label, or -1 for a declared label.
     *
     * @param label the label
     * @return 0, 1 or 2 for reserved labels, otherwise -1
     */
    public static int reservedRank(String label) {
        return RESERVED.indexOf(label);
    }

    public static List<String> reserved() {
        return RESERVED;
    }

    /**
     * Label of a raw value for a dimension without a bucket rule.
     *
     * <p>Whole numbers print without a fractional part ({@code 25}, not {@code 25.0}),
     * dates print as ISO dates.
     *
     * <p>Labels are the grouping key, so a string value spelled like a reserved label
     * (e.g. {@code "Missing"}) shares the group of that label. Bucket rules keep the two
     * apart only where the rule maps the value to its own label.
     *
     * @param value the typed value, or null when missing
     * @return the label
     */
    public static String rawLabel(Object value) {
        if (value == null) {
            return MISSING;
        }
        if (value instanceof Double d) {
            if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
                return Long.toString(d.longValue());
            }
            return d.toString();
        }
        if (value instanceof LocalDate date) {
            return date.toString();
        }
        return value.toString();
    }
}
