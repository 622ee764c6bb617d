package com.pivotdeck.bucket;

import com.pivotdeck.exception.ConfigurationException;
import com.pivotdeck.test.TestBase;
import com.pivotdeck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CustomBucketParser Tests")
@TestCategories.Unit
public class CustomBucketParserTest extends TestBase {

    @Test
    @DisplayName("Consecutive edges form contiguous ranges")
    void testContiguous() {
        NumericRangeRule rule = CustomBucketParser.parse("age", "0, 25, 50, 100");

        assertThat(rule.declaredLabels()).containsExactly("0-25", "25-50", "50-100");
        assertThat(rule.apply(25.0)).isEqualTo("25-50");
        assertThat(rule.apply(100.0)).isEqualTo(BucketLabels.UNSPECIFIED);
    }

    @Test
    @DisplayName("A trailing plus opens the last range")
    void testOpenEnded() {
        NumericRangeRule rule = CustomBucketParser.parse("total_revenue", "0, 100, 500+");

        assertThat(rule.declaredLabels()).containsExactly("0-100", "100-500", "500+");
        assertThat(rule.apply(1_000_000.0)).isEqualTo("500+");
    }

    @Test
    @DisplayName("Decimal edges keep their text in labels")
    void testDecimalEdges() {
        NumericRangeRule rule = CustomBucketParser.parse("churn_risk_score", "0, 0.5, 1");
        assertThat(rule.declaredLabels()).containsExactly("0-0.5", "0.5-1");
    }

    @ParameterizedTest(name = "\"{0}\"")
    @ValueSource(strings = {"", "10", "0, ten, 20", "0, 50, 25", "0, 10+, 20", "5, 5"})
    @DisplayName("Rejects malformed edge lists")
    void testInvalid(String text) {
        assertThatThrownBy(() -> CustomBucketParser.parse("age", text))
            .isInstanceOf(ConfigurationException.class);
    }
}
