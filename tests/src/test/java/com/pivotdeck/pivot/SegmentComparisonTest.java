package com.pivotdeck.pivot;

import com.pivotdeck.bucket.BucketLabels;
import com.pivotdeck.bucket.BucketRule;
import com.pivotdeck.bucket.BucketRules;
import com.pivotdeck.catalog.DimensionCatalog;
import com.pivotdeck.data.Dataset;
import com.pivotdeck.filter.Filter;
import com.pivotdeck.metric.MetricDef;
import com.pivotdeck.metric.MetricRegistry;
import com.pivotdeck.test.TestBase;
import com.pivotdeck.test.TestCategories;
import com.pivotdeck.test.UserFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.pivotdeck.bucket.NumericRange.of;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SegmentComparison Tests")
@TestCategories.Unit
@TestCategories.Tier2
public class SegmentComparisonTest extends TestBase {

    private static final BucketRule AGE = BucketRules.numericRanges("age",
        of(18, 25, "18-24"),
        of(25, 35, "25-34"),
        of(35, 50, "35-49"));

    private final Dataset users = UserFixtures.dataset();
    private final DimensionCatalog catalog = DimensionCatalog.fromSchema(users.schema());
    private final PivotAggregator aggregator = new PivotAggregator(new MetricRegistry());
    private final PivotSpec byAge = PivotSpec.builder().rows("age").metric(MetricDef.count("count")).build();

    private SegmentComparison compare(String baseline, String segment) {
        return SegmentComparison.compare(aggregator, users, List.of(AGE),
            Filter.parse(baseline, catalog), Filter.parse(segment, catalog), byAge);
    }

    private static LabelTuple t(String label) {
        return LabelTuple.of(label);
    }

    @Nested
    @DisplayName("Comparison")
    class Comparison {

        @Test
        @DisplayName("Reports both values with absolute and percent differences")
        void testDifferences() {
            SegmentComparison comparison = compare("", "country = 'US'");

            assertThat(comparison.difference(t("18-24"), LabelTuple.EMPTY, "count"))
                .hasValue(new SegmentComparison.Difference(2L, 2L, 0.0, 0.0));
            assertThat(comparison.difference(t("35-49"), LabelTuple.EMPTY, "count"))
                .hasValue(new SegmentComparison.Difference(1L, 1L, 0.0, 0.0));
            assertThat(comparison.grandTotal("count"))
                .isEqualTo(new SegmentComparison.Difference(8L, 4L, -4.0, -50.0));
        }

        @Test
        @DisplayName("Cells missing on one side have no difference")
        void testOneSidedCell() {
            SegmentComparison comparison = compare("", "country = 'US'");

            SegmentComparison.Difference diff =
                comparison.difference(t("25-34"), LabelTuple.EMPTY, "count").orElseThrow();
            assertThat(diff.baseline()).isEqualTo(3L);
            assertThat(diff.segment()).isNull();
            assertThat(diff.absolute()).isNull();
            assertThat(diff.percent()).isNull();
        }

        @Test
        @DisplayName("Rows are the union of both audiences in definition order")
        void testUnionRows() {
            SegmentComparison comparison = compare("country = 'DE'", "country = 'US'");

            assertThat(comparison.baseline().rows()).containsExactly(t("25-34"));
            assertThat(comparison.rows()).containsExactly(
                t("18-24"), t("25-34"), t("35-49"), t(BucketLabels.UNSPECIFIED));
            assertThat(comparison.difference(t("18-24"), LabelTuple.EMPTY, "count")).hasValueSatisfying(d -> {
                assertThat(d.baseline()).isNull();
                assertThat(d.segment()).isEqualTo(2L);
            });
            assertThat(comparison.difference(t(BucketLabels.MISSING), LabelTuple.EMPTY, "count")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Difference")
    class Differences {

        @Test
        @DisplayName("Percent is relative to the magnitude of the baseline")
        void testNegativeBaseline() {
            SegmentComparison.Difference diff = SegmentComparison.Difference.of(-10.0, -5.0);

            assertThat(diff.absolute()).isEqualTo(5.0);
            assertThat(diff.percent()).isEqualTo(50.0);
        }

        @Test
        @DisplayName("A zero baseline has no percent")
        void testZeroBaseline() {
            SegmentComparison.Difference diff = SegmentComparison.Difference.of(0L, 5L);

            assertThat(diff.absolute()).isEqualTo(5.0);
            assertThat(diff.percent()).isNull();
        }
    }
}
