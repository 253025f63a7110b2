package dev.configkit.core.validation.rules;

import dev.configkit.core.ConfigKit;
import dev.configkit.core.ConfigValidationError;
import dev.configkit.core.validation.ConfigValidationBuilder;
import dev.configkit.core.validation.PropertyRef;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the threshold rules over comparable values.
 */
class ComparableRulesTest {

    record Pool(Integer maxPoolSize) {
    }

    record Campaign(LocalDate startDate, BigDecimal discount, Duration cacheDuration, Duration reminderInterval) {
    }

    private static final PropertyRef<Pool, Integer> MAX_POOL_SIZE = PropertyRef.of("MaxPoolSize", Pool::maxPoolSize);

    @ParameterizedTest(name = "MaxPoolSize={0} -> valid={1}")
    @CsvSource({"0, false", "1, true", "500, true", "1000, true", "1001, false"})
    @DisplayName("Should accept both range bounds inclusively")
    void shouldCheckInclusiveRange(int value, boolean valid) {
        RangeRule<Pool, Integer> rule = new RangeRule<>(MAX_POOL_SIZE, 1, 1000, null);

        assertThat(rule.validate(new Pool(value), "Database").isEmpty()).isEqualTo(valid);
    }

    @Test
    @DisplayName("Should describe the range and current value")
    void shouldDescribeRangeFailure() {
        RangeRule<Pool, Integer> rule = new RangeRule<>(MAX_POOL_SIZE, 1, 1000, null);

        ConfigValidationError error = rule.validate(new Pool(0), "Database").orElseThrow();

        assertThat(error.key()).isEqualTo("Database:MaxPoolSize");
        assertThat(error.message()).isEqualTo("MaxPoolSize must be between 1 and 1000 (current: 0)");
        assertThat(error.currentValue()).isEqualTo(0);
        assertThat(error.suggestions()).containsExactly("Valid range: 1-1000", "Current value: 0");
    }

    @ParameterizedTest(name = "value={0} -> valid={1}")
    @CsvSource({"9, false", "10, false", "11, true"})
    @DisplayName("GreaterThan should exclude its bound")
    void greaterThanShouldExcludeBound(int value, boolean valid) {
        GreaterThanRule<Pool, Integer> rule = new GreaterThanRule<>(MAX_POOL_SIZE, 10, null);

        assertThat(rule.validate(new Pool(value), "Database").isEmpty()).isEqualTo(valid);
    }

    @ParameterizedTest(name = "value={0} -> valid={1}")
    @CsvSource({"9, true", "10, false", "11, false"})
    @DisplayName("LessThan should exclude its bound")
    void lessThanShouldExcludeBound(int value, boolean valid) {
        LessThanRule<Pool, Integer> rule = new LessThanRule<>(MAX_POOL_SIZE, 10, null);

        assertThat(rule.validate(new Pool(value), "Database").isEmpty()).isEqualTo(valid);
    }

    @ParameterizedTest(name = "value={0} -> valid={1}")
    @CsvSource({"9, false", "10, true", "11, true"})
    @DisplayName("Minimum should include its bound")
    void minimumShouldIncludeBound(int value, boolean valid) {
        MinimumRule<Pool, Integer> rule = new MinimumRule<>(MAX_POOL_SIZE, 10, null);

        assertThat(rule.validate(new Pool(value), "Database").isEmpty()).isEqualTo(valid);
    }

    @ParameterizedTest(name = "value={0} -> valid={1}")
    @CsvSource({"9, true", "10, true", "11, false"})
    @DisplayName("Maximum should include its bound")
    void maximumShouldIncludeBound(int value, boolean valid) {
        MaximumRule<Pool, Integer> rule = new MaximumRule<>(MAX_POOL_SIZE, 10, null);

        assertThat(rule.validate(new Pool(value), "Database").isEmpty()).isEqualTo(valid);
    }

    @Test
    @DisplayName("Should fail every bound for a null value")
    void shouldFailForNull() {
        MinimumRule<Pool, Integer> rule = new MinimumRule<>(MAX_POOL_SIZE, 1, null);

        ConfigValidationError error = rule.validate(new Pool(null), "Database").orElseThrow();

        assertThat(error.message()).isEqualTo("MaxPoolSize must be at least 1 (current: null)");
    }

    @Test
    @DisplayName("Should reject a range whose minimum exceeds its maximum")
    void shouldRejectInvertedRange() {
        assertThatThrownBy(() -> new RangeRule<>(MAX_POOL_SIZE, 10, 1, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should compare dates, decimals and durations through the same contract")
    void shouldSupportTemporalAndDecimalTypes() {
        LocalDate today = LocalDate.of(2026, 1, 15);
        ConfigValidationBuilder<Campaign> builder = ConfigKit.validate(Campaign.class, "Campaign")
                .minimum("startDate", Campaign::startDate, today, "Campaign must start today or later")
                .maximum("discount", Campaign::discount, new BigDecimal("0.75"))
                .maximum("cacheDuration", Campaign::cacheDuration, Duration.ofHours(24))
                .greaterThan("reminderInterval", Campaign::reminderInterval, Duration.ZERO);

        Campaign valid = new Campaign(today, new BigDecimal("0.75"), Duration.ofHours(24), Duration.ofMinutes(30));
        Campaign invalid = new Campaign(today.minusDays(1), new BigDecimal("0.80"), Duration.ofHours(25), Duration.ZERO);

        assertThat(builder.errors(valid)).isEmpty();

        List<ConfigValidationError> errors = builder.errors(invalid);
        assertThat(errors)
                .extracting(ConfigValidationError::key)
                .containsExactly("Campaign:startDate", "Campaign:discount", "Campaign:cacheDuration",
                        "Campaign:reminderInterval");
        assertThat(errors.get(0).message()).isEqualTo("Campaign must start today or later");
        assertThat(errors.get(2).message()).isEqualTo("cacheDuration must be at most PT24H (current: PT25H)");
    }
}
