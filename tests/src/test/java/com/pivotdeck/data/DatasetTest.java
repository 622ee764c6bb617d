package com.pivotdeck.data;

import com.pivotdeck.exception.TypeMismatchException;
import com.pivotdeck.exception.UnknownDimensionException;
import com.pivotdeck.test.TestBase;
import com.pivotdeck.test.TestCategories;
import com.pivotdeck.test.UserFixtures;
import com.pivotdeck.types.DataType;
import com.pivotdeck.types.Schema;
import com.pivotdeck.types.SchemaParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Dataset Loading Tests")
@TestCategories.Unit
@TestCategories.Tier1
public class DatasetTest extends TestBase {

    private static final Schema SCHEMA = SchemaParser.parse(
        "id:string not null, score:numeric, joined:date, active:boolean");

    @Test
    @DisplayName("Coerces raw values to their declared storage classes")
    void testCoercion() {
        logStep("Load one row with loosely typed values");
        Map<String, Object> row = new HashMap<>();
        row.put("id", "a");
        row.put("score", 7);
        row.put("joined", "2024-03-01T10:15:00");
        row.put("active", "true");

        Dataset dataset = Dataset.load(List.of(row), SCHEMA);

        Record record = dataset.records().get(0);
        assertThat(record.get("score")).isEqualTo(7.0);
        assertThat(record.get("joined")).isEqualTo(LocalDate.of(2024, 3, 1));
        assertThat(record.get("active")).isEqualTo(Boolean.TRUE);
    }

    @Test
    @DisplayName("Accepts LocalDateTime and Instant for date fields")
    void testTemporalCoercion() {
        assertThat(ValueCoercion.coerce(LocalDateTime.of(2024, 5, 6, 23, 59), SCHEMA.fieldByName("joined").dataType()))
            .isEqualTo(LocalDate.of(2024, 5, 6));
        assertThat(ValueCoercion.coerce(Instant.parse("2024-05-06T01:00:00Z"), SCHEMA.fieldByName("joined").dataType()))
            .isEqualTo(LocalDate.of(2024, 5, 6));
    }

    @Test
    @DisplayName("Null and absent values are both missing")
    void testMissingValues() {
        Map<String, Object> row = new HashMap<>();
        row.put("id", "a");
        row.put("score", null);

        Record record = Dataset.load(List.of(row), SCHEMA).records().get(0);

        assertThat(record.isMissing("score")).isTrue();
        assertThat(record.isMissing("joined")).isTrue();
        assertThat(record.get("score")).isNull();
    }

    @Test
    @DisplayName("Rejects values that cannot be coerced, naming the record and field")
    void testBadValue() {
        Map<String, Object> row = new HashMap<>();
        row.put("id", "a");
        row.put("score", "high");

        assertThatThrownBy(() -> Dataset.load(List.of(row), SCHEMA))
            .isInstanceOfSatisfying(TypeMismatchException.class, e -> {
                assertThat(e.getDimension()).isEqualTo("score");
                assertThat(e.getOffendingValue()).isEqualTo("high");
                assertThat(e.getMessage()).contains("Record 0");
            });
    }

    @Test
    @DisplayName("Rejects NaN and infinities, stores negative zero as zero")
    void testNonFiniteNumbers() {
        DataType numeric = SCHEMA.fieldByName("score").dataType();
        for (Object value : List.of("NaN", " -Infinity ", Double.NaN, Double.POSITIVE_INFINITY)) {
            assertThat(ValueCoercion.coerce(value, numeric)).as(String.valueOf(value)).isNull();
        }
        assertThat(ValueCoercion.coerce(-0.0, numeric)).isEqualTo(0.0);
        assertThat(ValueCoercion.coerce("-0", numeric)).isEqualTo(0.0);

        Map<String, Object> row = new HashMap<>();
        row.put("id", "a");
        row.put("score", "NaN");
        assertThatThrownBy(() -> Dataset.load(List.of(row), SCHEMA))
            .isInstanceOf(TypeMismatchException.class);
    }

    @Test
    @DisplayName("Rejects a missing non-nullable field")
    void testMissingRequired() {
        assertThatThrownBy(() -> Dataset.load(List.of(Map.of("score", 1)), SCHEMA))
            .isInstanceOf(TypeMismatchException.class)
            .hasMessageContaining("required");
    }

    @Test
    @DisplayName("Rejects fields not in the schema")
    void testUnknownField() {
        assertThatThrownBy(() -> Dataset.load(List.of(Map.of("id", "a", "color", "red")), SCHEMA))
            .isInstanceOfSatisfying(UnknownDimensionException.class,
                e -> assertThat(e.getDimension()).isEqualTo("color"));
    }

    @Test
    @DisplayName("Each load produces a new immutable dataset")
    void testImmutability() {
        Dataset first = UserFixtures.dataset();
        Dataset second = UserFixtures.dataset();

        assertThat(first.id()).isNotEqualTo(second.id());
        assertThat(first.records()).isEqualTo(second.records());
        assertThatThrownBy(() -> first.records().clear())
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> first.records().get(0).values().put("age", 1.0))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
