package com.pivotdeck;

import com.pivotdeck.bucket.BucketKind;
import com.pivotdeck.bucket.BucketPresets;
import com.pivotdeck.bucket.BucketRule;
import com.pivotdeck.bucket.NumericRange;
import com.pivotdeck.data.Dataset;
import com.pivotdeck.datagen.SyntheticUserGenerator;
import com.pivotdeck.exception.ConfigurationException;
import com.pivotdeck.filter.AudiencePresets;
import com.pivotdeck.filter.Filter;
import com.pivotdeck.metric.MetricDef;
import com.pivotdeck.metric.MetricPresets;
import com.pivotdeck.pivot.LabelTuple;
import com.pivotdeck.pivot.PivotResult;
import com.pivotdeck.pivot.PivotSpec;
import com.pivotdeck.pivot.SegmentComparison;
import com.pivotdeck.pivot.SegmentInsights;
import com.pivotdeck.test.TestBase;
import com.pivotdeck.test.TestCategories;
import com.pivotdeck.types.SchemaParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests over generated users using the preset buckets, audiences and metrics.
 */
@DisplayName("PivotEngine Tests")
@TestCategories.Integration
@TestCategories.Tier1
public class PivotEngineTest extends TestBase {

    private final PivotEngine engine = new PivotEngine();
    private final Dataset users = new SyntheticUserGenerator(42L, LocalDate.of(2025, 1, 1)).generateDataset(2000);
    private final BucketRule ageGroups = BucketPresets.preset("age", "Three Groups").orElseThrow();
    private final List<MetricDef> metrics = List.of(
        MetricPresets.COUNT, MetricPresets.AVG_LTV, MetricPresets.RETENTION_RATE, MetricPresets.AOV);

    @Test
    @DisplayName("Pivots an audience by age group and loyalty tier")
    void testPresetPivot() {
        logStep("Parse the Mobile Users audience");
        Filter mobile = engine.parseFilter(AudiencePresets.filterText("Mobile Users").orElseThrow(), users.schema());
        int expected = mobile.select(users.records()).size();

        logStep("Compute the pivot");
        PivotResult result = engine.computePivot(users, List.of(ageGroups), mobile,
            List.of("age"), List.of("loyalty_tier"), metrics, false);

        assertThat(result.filteredCount()).isEqualTo(expected);
        assertThat(result.grandTotal().get("Count")).isEqualTo((long) expected);
        assertThat(result.rows()).extracting(LabelTuple::displayName).containsExactly("18-25", "26-45", "46+");
        assertThat(result.columns()).extracting(LabelTuple::displayName)
            .containsExactly("Bronze", "Gold", "Platinum", "Silver");

        long cellCounts = result.cells().values().stream()
            .flatMap(byColumn -> byColumn.values().stream())
            .mapToLong(values -> values.get("Count").longValue())
            .sum();
        assertThat(cellCounts).isEqualTo(expected);
        assertThat(result.grandTotal().get("Retention Rate").doubleValue()).isBetween(0.0, 1.0);
        assertThat(result.metricNames()).containsExactly("Count", "Avg LTV", "Retention Rate", "AOV");
    }

    @Test
    @DisplayName("Both computePivot forms agree")
    void testSpecForm() {
        PivotSpec spec = PivotSpec.builder().rows("age").columns("device_type").metrics(metrics).build();
        Filter all = Filter.all();

        assertThat(engine.computePivot(users, List.of(ageGroups), all, spec))
            .isEqualTo(engine.computePivot(users, List.of(ageGroups), all,
                List.of("age"), List.of("device_type"), metrics, false));
    }

    @Test
    @DisplayName("Defines rules from kind and definition")
    void testDefineBucketRule() {
        BucketRule rule = engine.defineBucketRule("total_orders", BucketKind.NUMERIC_RANGE,
            List.of(NumericRange.of(0, 5, "few"), NumericRange.atLeast(5, "many")));
        PivotResult result = engine.computePivot(users, List.of(rule), Filter.all(),
            PivotSpec.builder().rows("total_orders").metric(MetricPresets.COUNT).build());

        assertThat(result.rows()).extracting(LabelTuple::displayName).containsExactly("few", "many");
        assertThatThrownBy(() -> engine.defineBucketRule("country", BucketKind.CATEGORICAL_GROUP, "US"))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Compares an audience with everyone and describes its buckets")
    void testComparisonAndInsights() {
        Filter highValue = engine.parseFilter(AudiencePresets.filterText("High Value Customers").orElseThrow(),
            users.schema());
        PivotSpec spec = PivotSpec.builder().rows("age").metric(MetricPresets.COUNT).metric(MetricPresets.AVG_LTV).build();

        SegmentComparison comparison = engine.compareSegments(users, List.of(ageGroups), Filter.all(), highValue, spec);
        SegmentComparison.Difference count = comparison.grandTotal("Count");
        assertThat(count.baseline()).isEqualTo(2000L);
        assertThat(count.absolute()).isLessThanOrEqualTo(0.0);
        assertThat(comparison.grandTotal("Avg LTV").absolute()).isPositive();

        SegmentInsights insights = engine.insights(users, ageGroups, highValue, "age", "ltv");
        assertThat(insights.byLabel().values())
            .allSatisfy(summary -> assertThat(summary.mean()).isGreaterThan(1000.0));
        int total = insights.byLabel().values().stream().mapToInt(SegmentInsights.Summary::size).sum();
        assertThat(total).isEqualTo(highValue.select(users.records()).size());
    }

    @Test
    @DisplayName("Loads raw records against a schema")
    void testLoadDataset() {
        Dataset small = engine.loadDataset(
            List.of(Map.of("user_id", "x", "age", 30)), SchemaParser.parse("user_id:string, age:numeric"));

        assertThat(small.size()).isEqualTo(1);
        assertThat(small.records().get(0).get("age")).isEqualTo(30.0);
    }
}
