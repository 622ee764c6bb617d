package com.pivotdeck.pivot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pivotdeck.catalog.DimensionCatalog;
import com.pivotdeck.data.Dataset;
import com.pivotdeck.filter.Filter;
import com.pivotdeck.metric.MetricDef;
import com.pivotdeck.metric.MetricRegistry;
import com.pivotdeck.test.TestBase;
import com.pivotdeck.test.TestCategories;
import com.pivotdeck.test.UserFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PivotResultJson Tests")
@TestCategories.Unit
@TestCategories.Tier1
public class PivotResultJsonTest extends TestBase {

    private final Dataset users = UserFixtures.dataset();
    private final PivotAggregator aggregator = new PivotAggregator(new MetricRegistry());
    private final PivotSpec byCountry = PivotSpec.builder()
        .rows("country")
        .metric(MetricDef.count("count"))
        .metric(MetricDef.mean("avg_ltv", "ltv"))
        .build();

    private PivotResult pivot(String filter) {
        return aggregator.computePivot(users, List.of(),
            Filter.parse(filter, DimensionCatalog.fromSchema(users.schema())), byCountry);
    }

    @Test
    @DisplayName("Writes labels, cells and totals by display name")
    void testShape() throws Exception {
        logStep("Serialize a country pivot");
        String json = new PivotResultJson().toJson(pivot(""));
        JsonNode root = new ObjectMapper().readTree(json);

        assertThat(root.fieldNames()).toIterable()
            .containsExactly("rows", "columns", "cells", "rowTotals", "columnTotals", "grandTotal");
        assertThat(root.get("rows")).extracting(JsonNode::asText).containsExactly("DE", "FR", "US");
        assertThat(root.get("columns")).extracting(JsonNode::asText).containsExactly("All");
        assertThat(root.at("/cells/US/All/count").asLong()).isEqualTo(4L);
        assertThat(root.at("/cells/FR/All/avg_ltv").asDouble()).isEqualTo(37.5);
        assertThat(root.at("/rowTotals/DE/count").isIntegralNumber()).isTrue();
        assertThat(root.at("/grandTotal/avg_ltv").asDouble()).isEqualTo(93.125);
    }

    @Test
    @DisplayName("Rounds floating-point values half-up to the display scale")
    void testScale() {
        JsonNode root = new PivotResultJson(2).toJsonNode(pivot(""));

        assertThat(root.at("/grandTotal/avg_ltv").decimalValue()).isEqualByComparingTo("93.13");
        assertThat(root.at("/grandTotal/count").asLong()).isEqualTo(8L);
    }

    @Test
    @DisplayName("Undefined values are written as null")
    void testNulls() {
        JsonNode root = new PivotResultJson(2).toJsonNode(pivot("ltv > 100000"));

        assertThat(root.get("rows")).isEmpty();
        assertThat(root.at("/grandTotal/avg_ltv").isNull()).isTrue();
        assertThat(root.at("/grandTotal/count").asLong()).isZero();
    }
}
