package com.pivotdeck.config;

import com.pivotdeck.exception.ConfigurationException;
import com.pivotdeck.test.TestBase;
import com.pivotdeck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PivotDeckConfig Tests")
@TestCategories.Unit
@TestCategories.Tier2
public class PivotDeckConfigTest extends TestBase {

    @Test
    @DisplayName("Unset and blank properties take their defaults")
    void testDefaults() {
        Properties properties = new Properties();
        properties.setProperty(PivotDeckConfig.PROP_RESULT_SCALE, "  ");

        PivotDeckConfig config = PivotDeckConfig.fromProperties(properties);

        assertThat(config.generatorSeed()).isEqualTo(42L);
        assertThat(config.generatorCount()).isEqualTo(5000);
        assertThat(config.referenceDate()).isEqualTo(LocalDate.of(2025, 1, 1));
        assertThat(config.resultScale()).isEqualTo(-1);
        assertThat(config.sessionThreads()).isEqualTo(2);
        assertThat(config.toString()).isEqualTo(PivotDeckConfig.defaults().toString());
    }

    @Test
    @DisplayName("Reads every property")
    void testOverrides() {
        Properties properties = new Properties();
        properties.setProperty(PivotDeckConfig.PROP_GENERATOR_SEED, "7");
        properties.setProperty(PivotDeckConfig.PROP_GENERATOR_COUNT, " 250 ");
        properties.setProperty(PivotDeckConfig.PROP_GENERATOR_REFERENCE_DATE, "2024-06-30");
        properties.setProperty(PivotDeckConfig.PROP_RESULT_SCALE, "2");
        properties.setProperty(PivotDeckConfig.PROP_SESSION_THREADS, "4");

        PivotDeckConfig config = PivotDeckConfig.fromProperties(properties);

        assertThat(config.generatorSeed()).isEqualTo(7L);
        assertThat(config.generatorCount()).isEqualTo(250);
        assertThat(config.referenceDate()).isEqualTo(LocalDate.of(2024, 6, 30));
        assertThat(config.resultScale()).isEqualTo(2);
        assertThat(config.sessionThreads()).isEqualTo(4);
    }

    @ParameterizedTest(name = "{0}={1}")
    @CsvSource({
        "pivotdeck.generator.seed, abc",
        "pivotdeck.generator.count, -1",
        "pivotdeck.generator.count, 1.5",
        "pivotdeck.generator.referenceDate, 2024-13-01",
        "pivotdeck.result.scale, -2",
        "pivotdeck.session.threads, 0"
    })
    @DisplayName("Invalid values name the offending property")
    void testInvalidValues(String key, String value) {
        Properties properties = new Properties();
        properties.setProperty(key, value);

        assertThatThrownBy(() -> PivotDeckConfig.fromProperties(properties))
            .isInstanceOfSatisfying(ConfigurationException.class,
                e -> assertThat(e.getSubject()).isEqualTo(key));
    }
}
