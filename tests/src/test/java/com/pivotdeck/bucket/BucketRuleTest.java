package com.pivotdeck.bucket;

import com.pivotdeck.catalog.DimensionCatalog;
import com.pivotdeck.exception.ConfigurationException;
import com.pivotdeck.exception.UnknownDimensionException;
import com.pivotdeck.test.TestBase;
import com.pivotdeck.test.TestCategories;
import com.pivotdeck.test.UserFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static com.pivotdeck.bucket.NumericRange.atLeast;
import static com.pivotdeck.bucket.NumericRange.below;
import static com.pivotdeck.bucket.NumericRange.of;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the bucket rule engine.
 *
 * <p>Covers:
 * - numeric ranges: boundaries, gaps, open bounds, validation
 * - categorical groups: mapped values and "Other"
 * - date granularities: calendar and ISO week labels
 * - the "Missing" label for every kind
 */
@DisplayName("Bucket Rule Engine Tests")
@TestCategories.Unit
@TestCategories.Tier1
public class BucketRuleTest extends TestBase {

    private static final NumericRangeRule AGE = BucketRules.numericRanges("age",
        of(18, 25, "18-24"),
        of(25, 35, "25-34"),
        of(45, 65, "45-64"));

    // ==================== Numeric Ranges ====================

    @Nested
    @DisplayName("Numeric Ranges")
    class NumericRanges {

        @Test
        @DisplayName("A boundary value belongs to the range that starts there")
        void testBoundary() {
            logStep("Apply [18,25) and [25,35) to their boundaries");

            assertThat(BucketRules.apply(AGE, 18.0)).isEqualTo("18-24");
            assertThat(BucketRules.apply(AGE, 25.0)).isEqualTo("25-34");
            assertThat(BucketRules.apply(AGE, 24.999)).isEqualTo("18-24");
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "17.9, Unspecified",
            "40, Unspecified",
            "65, Unspecified",
            "64.5, 45-64"
        })
        @DisplayName("Gaps and values beyond the bounds are Unspecified")
        void testGaps(double value, String expected) {
            assertThat(BucketRules.apply(AGE, value)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Open bounds cover the whole line")
        void testOpenBounds() {
            NumericRangeRule rule = BucketRules.numericRanges("ltv",
                below(0, "Negative"), of(0, 100, "Small"), atLeast(100, "Large"));

            assertThat(rule.apply(-1e9)).isEqualTo("Negative");
            assertThat(rule.apply(0.0)).isEqualTo("Small");
            assertThat(rule.apply(1e12)).isEqualTo("Large");
        }

        @Test
        @DisplayName("Every value gets exactly one label")
        void testExhaustive() {
            NumericRangeRule rule = BucketRules.numericRanges("ltv",
                below(10, "low"), of(10, 20, "mid"), atLeast(20, "high"));
            Random random = new Random(7);
            for (int i = 0; i < 1000; i++) {
                double value = (random.nextDouble() - 0.5) * 100;
                String label = rule.apply(value);
                long matching = rule.ranges().stream().filter(r -> r.contains(value)).count();
                assertThat(matching).isEqualTo(1);
                assertThat(rule.declaredLabels()).contains(label);
            }
        }

        @Test
        @DisplayName("Rejects overlapping ranges")
        void testOverlap() {
            assertThatThrownBy(() -> BucketRules.numericRanges("age", of(18, 30, "a"), of(25, 35, "b")))
                .isInstanceOfSatisfying(ConfigurationException.class,
                    e -> assertThat(e.getSubject()).isEqualTo("age"));
        }

        @Test
        @DisplayName("Rejects ranges out of order")
        void testOrder() {
            assertThatThrownBy(() -> BucketRules.numericRanges("age", of(25, 35, "b"), of(18, 25, "a")))
                .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("Rejects inverted, empty and duplicate definitions")
        void testInvalidDefinitions() {
            assertThatThrownBy(() -> BucketRules.numericRanges("age", of(30, 20, "x")))
                .isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> BucketRules.define("age", BucketKind.NUMERIC_RANGE, List.of()))
                .isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> BucketRules.numericRanges("age", of(0, 1, "x"), of(1, 2, "x")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Duplicate");
        }

        @Test
        @DisplayName("Rejects reserved labels")
        void testReservedLabel() {
            assertThatThrownBy(() -> BucketRules.numericRanges("age", of(0, 1, BucketLabels.MISSING)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("reserved");
        }

        @Test
        @DisplayName("Gaps between ranges are allowed")
        void testGapAllowed() {
            assertThat(AGE.declaredLabels()).containsExactly("18-24", "25-34", "45-64");
        }
    }

    // ==================== Categorical Groups ====================

    @Nested
    @DisplayName("Categorical Groups")
    class CategoricalGroups {

        private final CategoricalGroupRule tiers = BucketRules.categorical("tier", mapping(
            "Gold", "Premium",
            "Platinum", "Premium",
            "Bronze", "Standard"));

        @Test
        @DisplayName("Maps known values and sends the rest to Other")
        void testMapping() {
            assertThat(tiers.apply("Gold")).isEqualTo("Premium");
            assertThat(tiers.apply("Bronze")).isEqualTo("Standard");
            assertThat(tiers.apply("Silver")).isEqualTo(BucketLabels.OTHER);
        }

        @Test
        @DisplayName("Declared labels are distinct, in declaration order")
        void testDeclaredLabels() {
            assertThat(tiers.declaredLabels()).containsExactly("Premium", "Standard");
        }

        @Test
        @DisplayName("Matching is exact")
        void testExactMatch() {
            assertThat(tiers.apply("gold")).isEqualTo(BucketLabels.OTHER);
        }

        @Test
        @DisplayName("Rejects an empty mapping")
        void testEmpty() {
            assertThatThrownBy(() -> BucketRules.define("tier", BucketKind.CATEGORICAL_GROUP, Map.of()))
                .isInstanceOf(ConfigurationException.class);
        }
    }

    // ==================== Date Granularity ====================

    @Nested
    @DisplayName("Date Granularity")
    class DateGranularities {

        @ParameterizedTest(name = "{0} by {1} -> {2}")
        @CsvSource({
            "2024-03-15, YEAR, 2024",
            "2024-03-15, QUARTER, 2024-Q1",
            "2024-10-01, QUARTER, 2024-Q4",
            "2024-03-15, MONTH, 2024-03",
            "2024-01-31, WEEK, 2024-W05",
            "2024-12-30, WEEK, 2025-W01",
            "2021-01-03, WEEK, 2020-W53"
        })
        @DisplayName("Truncates to the calendar unit")
        void testLabels(String date, DateGranularity granularity, String expected) {
            BucketRule rule = BucketRules.dateGranularity("signup_date", granularity);
            assertThat(rule.apply(LocalDate.parse(date))).isEqualTo(expected);
        }

        @Test
        @DisplayName("Accepts the granularity by name")
        void testDefineByName() {
            BucketRule rule = BucketRules.define("signup_date", BucketKind.DATE_GRANULARITY, "Month");
            assertThat(rule.apply(LocalDate.of(2023, 7, 4))).isEqualTo("2023-07");
            assertThatThrownBy(() -> BucketRules.define("signup_date", BucketKind.DATE_GRANULARITY, "decade"))
                .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("Orders labels chronologically with Missing last")
        void testOrder() {
            BucketRule rule = BucketRules.dateGranularity("signup_date", DateGranularity.MONTH);
            List<String> labels = new ArrayList<>(List.of("2024-11", BucketLabels.MISSING, "2023-02", "2024-01"));
            labels.sort(rule.labelOrder());
            assertThat(labels).containsExactly("2023-02", "2024-01", "2024-11", BucketLabels.MISSING);
        }
    }

    // ==================== Missing Values ====================

    @Test
    @DisplayName("Missing values are labelled Missing by every kind")
    void testMissing() {
        assertThat(BucketRules.apply(AGE, null)).isEqualTo(BucketLabels.MISSING);
        assertThat(BucketRules.apply(BucketRules.categorical("tier", Map.of("Gold", "G")), null))
            .isEqualTo(BucketLabels.MISSING);
        assertThat(BucketRules.apply(BucketRules.dateGranularity("signup_date", DateGranularity.YEAR), null))
            .isEqualTo(BucketLabels.MISSING);
    }

    @Test
    @DisplayName("Reserved labels sort after declared labels")
    void testLabelOrder() {
        List<String> labels = new ArrayList<>(List.of(
            BucketLabels.MISSING, "45-64", BucketLabels.UNSPECIFIED, "18-24"));
        labels.sort(AGE.labelOrder());
        assertThat(labels).containsExactly("18-24", "45-64", BucketLabels.UNSPECIFIED, BucketLabels.MISSING);
    }

    // ==================== Validation Against the Catalog ====================

    @Nested
    @DisplayName("Catalog Validation")
    class CatalogValidation {

        private final DimensionCatalog catalog = DimensionCatalog.fromSchema(UserFixtures.SCHEMA);

        @Test
        @DisplayName("Accepts rules whose kind fits the dimension type")
        void testCompatible() {
            BucketRules.validateFor(AGE, catalog);
            BucketRules.validateFor(BucketRules.categorical("country", Map.of("US", "NA")), catalog);
            BucketRules.validateFor(BucketRules.dateGranularity("signup_date", DateGranularity.WEEK), catalog);
        }

        @Test
        @DisplayName("Rejects a range rule on a string dimension")
        void testIncompatible() {
            NumericRangeRule rule = BucketRules.numericRanges("country", of(0, 1, "x"));
            assertThatThrownBy(() -> BucketRules.validateFor(rule, catalog))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("string");
        }

        @Test
        @DisplayName("Rejects a rule on an unknown dimension")
        void testUnknown() {
            NumericRangeRule rule = BucketRules.numericRanges("height", of(0, 1, "x"));
            assertThatThrownBy(() -> BucketRules.validateFor(rule, catalog))
                .isInstanceOf(UnknownDimensionException.class);
        }
    }

    private static Map<String, String> mapping(String... pairs) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return map;
    }
}
