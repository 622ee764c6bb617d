package com.pivotdeck.bucket;

import java.util.Comparator;
import java.util.List;

/**
 * A total mapping from the values of one dimension to bucket labels.
 *
 * <p>Rules are immutable and validated when they are constructed; {@link #apply}
 * never fails. Every rule maps a missing value ({@code null}) to
 * {@link BucketLabels#MISSING}, whatever its kind.
 *
 * @see BucketRules
 */
public sealed interface BucketRule
    permits NumericRangeRule, CategoricalGroupRule, DateGranularityRule {

    /**
     * Returns the dimension this rule buckets.
     *
     * @return the dimension name
     */
    String dimension();

    BucketKind kind();

    /**
     * Maps a typed value to its label.
     *
     * @param value the value, or null if missing
     * @return the label, never null
     */
    String apply(Object value);

    /**
     * Returns the labels in the order the analyst declared them.
     *
     * <p>Date rules have no fixed label set and return an empty list.
     *
     * @return the declared labels
     */
    List<String> declaredLabels();

    /**
     * Returns the display order of labels produced by this rule: declared labels in
     * declaration order, then the reserved labels.
     *
     * @return a comparator over labels
     */
    default Comparator<String> labelOrder() {
        List<String> declared = declaredLabels();
        return Comparator.comparingInt((String label) -> {
            int index = declared.indexOf(label);
            if (index >= 0) {
                return index;
            }
            return declared.size() + Math.max(BucketLabels.reservedRank(label), 0);
        });
    }
}
