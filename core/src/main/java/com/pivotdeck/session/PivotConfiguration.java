package com.pivotdeck.session;

import com.pivotdeck.bucket.BucketRule;
import com.pivotdeck.pivot.PivotSpec;

import java.util.List;
import java.util.Objects;

/**
 * One user configuration of a session's pivot: bucket rules, filter text and pivot shape.
 *
 * @param bucketRules the active bucket rules
 * @param filterText the active filter, blank for all records
 * @param spec the pivot shape
 */
public record PivotConfiguration(List<BucketRule> bucketRules, String filterText, PivotSpec spec) {

    public PivotConfiguration {
        Objects.requireNonNull(bucketRules, "bucketRules must not be null");
        Objects.requireNonNull(spec, "spec must not be null");
        bucketRules = List.copyOf(bucketRules);
        filterText = filterText == null ? "" : filterText;
    }

    public static PivotConfiguration of(PivotSpec spec) {
        return new PivotConfiguration(List.of(), "", spec);
    }

    public PivotConfiguration withFilter(String text) {
        return new PivotConfiguration(bucketRules, text, spec);
    }
}
