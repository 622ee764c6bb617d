package com.pivotdeck.bucket;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.pivotdeck.bucket.NumericRange.atLeast;
import static com.pivotdeck.bucket.NumericRange.of;

/**
 * Named bucket rules offered to analysts for the user dimensions.
 *
 * <p>Presets are ordinary validated rules; an analyst picks one by name instead of
 * typing ranges. The option list for a dimension also contains the two pseudo
 * options {@link #NO_BUCKETING} and {@link #CUSTOM_BUCKETS}, which the caller
 * resolves itself (raw values, or {@link CustomBucketParser}).
 */
public final class BucketPresets {

    public static final String NO_BUCKETING = "No Bucketing";
    public static final String CUSTOM_BUCKETS = "Custom Buckets";

    private static final Map<String, Map<String, BucketRule>> PRESETS = new LinkedHashMap<>();

    static {
        initializeDemographics();
        initializeRecency();
        initializeRevenue();
        initializeScores();
        initializeDates();
    }

    private BucketPresets() {}

    /**
     * Returns the bucketing options for a dimension, in display order.
     *
     * @param dimension the dimension name
     * @return "No Bucketing", the preset names, then "Custom Buckets"
     */
    public static List<String> optionsFor(String dimension) {
        List<String> options = new ArrayList<>();
        options.add(NO_BUCKETING);
        options.addAll(PRESETS.getOrDefault(dimension, Collections.emptyMap()).keySet());
        options.add(CUSTOM_BUCKETS);
        return options;
    }

    /**
     * Looks up a preset rule.
     *
     * @param dimension the dimension name
     * @param presetName the preset name, e.g. "Three Groups"
     * @return the rule, or empty if no such preset exists
     */
    public static Optional<BucketRule> preset(String dimension, String presetName) {
        return Optional.ofNullable(PRESETS.getOrDefault(dimension, Collections.emptyMap()).get(presetName));
    }

    public static List<String> bucketedDimensions() {
        return List.copyOf(PRESETS.keySet());
    }

    private static void register(String dimension, String name, BucketRule rule) {
        PRESETS.computeIfAbsent(dimension, d -> new LinkedHashMap<>()).put(name, rule);
    }

    private static void ranges(String dimension, String name, NumericRange... ranges) {
        register(dimension, name, BucketRules.numericRanges(dimension, ranges));
    }

    // ==================== Demographics ====================

    private static void initializeDemographics() {
        ranges("age", "Young/Old",
            of(0, 36, "Young (18-35)"),
            atLeast(36, "Mature (36+)"));
        ranges("age", "Three Groups",
            of(0, 26, "18-25"),
            of(26, 46, "26-45"),
            atLeast(46, "46+"));
        ranges("age", "Fine Grained",
            of(0, 21, "18-20"),
            of(21, 26, "21-25"),
            of(26, 36, "26-35"),
            of(36, 51, "36-50"),
            atLeast(51, "51+"));
    }

    // ==================== Tenure and Recency ====================

    private static void initializeRecency() {
        ranges("days_since_signup", "New/Established",
            of(0, 91, "New (0-90 days)"),
            atLeast(91, "Established (90+ days)"));
        ranges("days_since_signup", "Quarterly",
            of(0, 91, "0-3 months"),
            of(91, 181, "3-6 months"),
            of(181, 366, "6-12 months"),
            atLeast(366, "1+ years"));
        ranges("days_since_signup", "Monthly",
            of(0, 31, "0-1 month"),
            of(31, 61, "1-2 months"),
            of(61, 91, "2-3 months"),
            of(91, 181, "3-6 months"),
            of(181, 366, "6-12 months"),
            atLeast(366, "1+ years"));

        ranges("days_since_last_purchase", "Recent/Lapsed",
            of(0, 31, "Recent (0-30 days)"),
            atLeast(31, "Lapsed (30+ days)"));
        ranges("days_since_last_purchase", "Recency Groups",
            of(0, 8, "0-7 days"),
            of(8, 31, "8-30 days"),
            of(31, 91, "31-90 days"),
            atLeast(91, "90+ days"));
        ranges("days_since_last_purchase", "Weekly",
            of(0, 8, "0-1 week"),
            of(8, 15, "1-2 weeks"),
            of(15, 22, "2-3 weeks"),
            of(22, 31, "3-4 weeks"),
            of(31, 61, "1-2 months"),
            of(61, 91, "2-3 months"),
            atLeast(91, "3+ months"));
    }

    // ==================== Revenue and Orders ====================

    private static void initializeRevenue() {
        ranges("total_revenue", "Low/Medium/High",
            of(0, 100, "Low (<$100)"),
            of(100, 500, "Medium ($100-500)"),
            atLeast(500, "High ($500+)"));
        ranges("total_revenue", "Detailed",
            of(0, 50, "<$50"),
            of(50, 100, "$50-100"),
            of(100, 250, "$100-250"),
            of(250, 500, "$250-500"),
            of(500, 1000, "$500-1000"),
            atLeast(1000, "$1000+"));

        ranges("ltv", "Low/Medium/High",
            of(0, 200, "Low (<$200)"),
            of(200, 1000, "Medium ($200-1000)"),
            atLeast(1000, "High ($1000+)"));
        ranges("ltv", "Detailed",
            of(0, 100, "<$100"),
            of(100, 250, "$100-250"),
            of(250, 500, "$250-500"),
            of(500, 1000, "$500-1000"),
            of(1000, 2000, "$1000-2000"),
            atLeast(2000, "$2000+"));

        ranges("total_orders", "Low/Medium/High",
            of(0, 3, "Low (0-2)"),
            of(3, 11, "Medium (3-10)"),
            atLeast(11, "High (11+)"));
        ranges("total_orders", "Detailed",
            of(0, 2, "0-1"),
            of(2, 4, "2-3"),
            of(4, 6, "4-5"),
            of(6, 11, "6-10"),
            of(11, 21, "11-20"),
            atLeast(21, "21+"));
    }

    // ==================== Scores ====================

    private static void initializeScores() {
        ranges("churn_risk_score", "Risk Levels",
            of(0, 0.3, "Low Risk"),
            of(0.3, 0.7, "Medium Risk"),
            atLeast(0.7, "High Risk"));
        ranges("nps_score", "NPS Categories",
            of(0, 7, "Detractors (0-6)"),
            of(7, 9, "Passives (7-8)"),
            of(9, 11, "Promoters (9-10)"));
    }

    // ==================== Dates ====================

    private static void initializeDates() {
        register("signup_date", "By Year", BucketRules.dateGranularity("signup_date", DateGranularity.YEAR));
        register("signup_date", "By Quarter", BucketRules.dateGranularity("signup_date", DateGranularity.QUARTER));
        register("signup_date", "By Month", BucketRules.dateGranularity("signup_date", DateGranularity.MONTH));
        register("signup_date", "By Week", BucketRules.dateGranularity("signup_date", DateGranularity.WEEK));
    }
}
