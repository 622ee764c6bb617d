package com.pivotdeck.filter;

import com.pivotdeck.bucket.NumericRange;
import com.pivotdeck.catalog.DimensionCatalog;
import com.pivotdeck.data.Dataset;
import com.pivotdeck.data.Record;
import com.pivotdeck.exception.TypeMismatchException;
import com.pivotdeck.exception.UnknownDimensionException;
import com.pivotdeck.test.TestBase;
import com.pivotdeck.test.TestCategories;
import com.pivotdeck.test.UserFixtures;
import com.pivotdeck.types.SchemaParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for type checking and evaluating filters over records.
 */
@DisplayName("Filter Evaluation Tests")
@TestCategories.Unit
@TestCategories.Tier1
public class FilterEvaluatorTest extends TestBase {

    private final Dataset users = UserFixtures.dataset();
    private final DimensionCatalog catalog = DimensionCatalog.fromSchema(users.schema());

    private List<String> ids(String filterText) {
        return Filter.parse(filterText, catalog).select(users.records()).stream()
            .map(r -> (String) r.get("user_id"))
            .toList();
    }

    @Nested
    @DisplayName("Semantics")
    class Semantics {

        @Test
        @DisplayName("Conjunction over the documented example keeps only the first record")
        void testDocumentedExample() {
            logStep("Load the three example records");
            Dataset dataset = Dataset.load(List.of(
                Map.of("age", 30, "LTV", 10),
                Map.of("age", 20, "LTV", 10),
                Map.of("age", 40, "LTV", 50)), SchemaParser.parse("age:numeric, LTV:numeric"));

            logStep("Evaluate age>25 AND LTV<30");
            Filter filter = Filter.parse("age>25 AND LTV<30", DimensionCatalog.fromSchema(dataset.schema()));
            List<Record> selected = filter.select(dataset.records());

            assertThat(selected).containsExactly(dataset.records().get(0));
        }

        @ParameterizedTest(name = "{0}")
        @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "country = 'US'|u1,u2,u5,u7",
            "country != US|u3,u4,u6,u8",
            "ltv >= 40 AND ltv < 100|u4,u6,u7",
            "country = DE OR tier = Platinum|u3,u4,u5",
            "(country = DE OR country = FR) AND ltv > 20|u3,u4,u6",
            "tier in ('Gold', 'Platinum')|u1,u3,u5,u8",
            "tier contains 'il'|u2,u6",
            "signup_date >= '2024-07-01'|u5,u6,u7",
            "is_retained = false|u3,u6",
            "age in (18, 25)|u1,u3"
        })
        @DisplayName("Selects the expected users")
        void testSelection(String filterText, String expectedIds) {
            assertThat(ids(filterText)).containsExactly(expectedIds.split(","));
        }

        @Test
        @DisplayName("Contains is case-sensitive")
        void testContainsCaseSensitive() {
            assertThat(ids("tier contains 'IL'")).isEmpty();
        }

        @Test
        @DisplayName("Blank filter selects everything in order")
        void testMatchAll() {
            Filter filter = Filter.parse("", catalog);

            assertThat(filter.isMatchAll()).isTrue();
            assertThat(filter.select(users.records())).containsExactlyElementsOf(users.records());
        }

        @Test
        @DisplayName("Evaluation does not modify the dataset")
        void testNoMutation() {
            List<Record> before = List.copyOf(users.records());
            Filter.parse("age > 30", catalog).select(users.records());
            assertThat(users.records()).containsExactlyElementsOf(before);
        }
    }

    @Nested
    @DisplayName("Numeric Edge Values")
    class NumericEdgeValues {

        private Record withAge(double age) {
            return new Record(Map.of("user_id", "x", "age", age));
        }

        @Test
        @DisplayName("Negative zero compares equal to zero, as in bucket ranges")
        void testNegativeZero() {
            Record record = withAge(-0.0);

            assertThat(Filter.parse("age = 0", catalog).matches(record)).isTrue();
            assertThat(Filter.parse("age < 0", catalog).matches(record)).isFalse();
            assertThat(Filter.parse("age >= 0", catalog).matches(record)).isTrue();
            assertThat(Filter.parse("age in (0, 1)", catalog).matches(record)).isTrue();
            assertThat(NumericRange.of(0, 10, "low").contains(-0.0)).isTrue();
        }

        @Test
        @DisplayName("NaN satisfies no ordered comparison")
        void testNaN() {
            Record record = withAge(Double.NaN);

            for (String text : List.of("age > 5", "age >= 5", "age < 5", "age <= 5", "age = 5")) {
                assertThat(Filter.parse(text, catalog).matches(record)).as(text).isFalse();
            }
            assertThat(Filter.parse("age != 5", catalog).matches(record)).isTrue();
        }
    }

    @Nested
    @DisplayName("Missing Values")
    class MissingValues {

        @Test
        @DisplayName("A record missing age is excluded by age > 25 but included by age != 25")
        void testMissingPolicy() {
            assertThat(ids("age > 25")).doesNotContain("u6");
            assertThat(ids("age != 25")).contains("u6");
        }

        @Test
        @DisplayName("Every operator except != is false on a missing value")
        void testAllOperators() {
            Map<String, Object> values = new HashMap<>();
            values.put("user_id", "x");
            Record empty = new Record(values);

            for (String text : List.of("age = 1", "age > 1", "age >= 1", "age < 1", "age <= 1", "age in (1, 2)",
                                       "tier contains 'o'", "tier = Gold", "is_retained = true")) {
                assertThat(Filter.parse(text, catalog).matches(empty)).as(text).isFalse();
            }
            assertThat(Filter.parse("tier != Gold", catalog).matches(empty)).isTrue();
            assertThat(Filter.parse("is_retained != true", catalog).matches(empty)).isTrue();
        }
    }

    @Nested
    @DisplayName("Type Checking")
    class TypeChecking {

        @Test
        @DisplayName("Rejects a string literal for a numeric dimension")
        void testStringForNumber() {
            assertThatThrownBy(() -> Filter.parse("age > 'old'", catalog))
                .isInstanceOfSatisfying(TypeMismatchException.class, e -> {
                    assertThat(e.getDimension()).isEqualTo("age");
                    assertThat(e.getOffendingValue()).isEqualTo("old");
                    assertThat(e.getMessage()).contains("position 6");
                });
        }

        @Test
        @DisplayName("Rejects an operator the dimension type does not allow")
        void testOperatorNotAllowed() {
            assertThatThrownBy(() -> Filter.parse("country > 'US'", catalog))
                .isInstanceOf(TypeMismatchException.class)
                .hasMessageContaining("'>'");
            assertThatThrownBy(() -> Filter.parse("is_retained in (true)", catalog))
                .isInstanceOf(TypeMismatchException.class);
        }

        @Test
        @DisplayName("Rejects malformed dates and non-boolean literals")
        void testDatesAndBooleans() {
            assertThatThrownBy(() -> Filter.parse("signup_date > '2024-13-01'", catalog))
                .isInstanceOf(TypeMismatchException.class);
            assertThatThrownBy(() -> Filter.parse("is_retained = 1", catalog))
                .isInstanceOf(TypeMismatchException.class);
        }

        @Test
        @DisplayName("Rejects unknown dimensions")
        void testUnknownDimension() {
            assertThatThrownBy(() -> Filter.parse("age > 1 AND height > 180", catalog))
                .isInstanceOfSatisfying(UnknownDimensionException.class,
                    e -> assertThat(e.getDimension()).isEqualTo("height"));
        }

        @Test
        @DisplayName("Unchecked comparisons cannot be evaluated")
        void testUnbound() {
            FilterExpression unbound = FilterParser.parse("age > 1");
            Record record = users.records().get(0);
            assertThatThrownBy(() -> FilterEvaluator.matches(unbound, record))
                .isInstanceOf(IllegalStateException.class);
        }
    }
}
