package dev.configkit.core.validation.rules;

import dev.configkit.core.ConfigValidationError;
import dev.configkit.core.validation.PropertyRef;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Optional;
import java.util.regex.PatternSyntaxException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the not-empty, not-null and pattern rules.
 */
class BasicRulesTest {

    record Service(String name, String version, List<String> hosts) {
    }

    private static Service named(String name) {
        return new Service(name, "1.0.0", List.of());
    }

    @Nested
    @DisplayName("NotEmptyRule")
    class NotEmpty {

        private final NotEmptyRule<Service> rule = new NotEmptyRule<>(PropertyRef.of("Name", Service::name), null);

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {" ", "\t\n"})
        @DisplayName("Should fail for null, empty and whitespace values")
        void shouldFailForBlank(String value) {
            Optional<ConfigValidationError> error = rule.validate(named(value), "App");

            assertThat(error).isPresent();
            assertThat(error.get().key()).isEqualTo("App:Name");
            assertThat(error.get().message()).isEqualTo("Name must not be empty");
        }

        @Test
        @DisplayName("Should suggest environment variable and system property")
        void shouldSuggestWhereToSetValue() {
            ConfigValidationError error = rule.validate(named(""), "App").orElseThrow();

            assertThat(error.suggestions())
                    .anySatisfy(s -> assertThat(s).contains("APP_NAME"))
                    .anySatisfy(s -> assertThat(s).contains("-DApp.Name=<value>"));
        }

        @Test
        @DisplayName("Should pass for a non-blank value")
        void shouldPassForValue() {
            assertThat(rule.validate(named("orders"), "App")).isEmpty();
        }
    }

    @Nested
    @DisplayName("NotNullRule")
    class NotNull {

        @Test
        @DisplayName("Should fail for a null property of any type")
        void shouldFailForNull() {
            NotNullRule<Service, List<String>> rule = new NotNullRule<>(PropertyRef.of("hosts", Service::hosts), null);

            ConfigValidationError error = rule.validate(new Service("a", "1", null), "Cluster").orElseThrow();

            assertThat(error.key()).isEqualTo("Cluster:hosts");
            assertThat(error.message()).isEqualTo("hosts must not be null");
            assertThat(error.currentValue()).isNull();
        }

        @Test
        @DisplayName("Should pass for empty but non-null values")
        void shouldPassForEmptyValue() {
            NotNullRule<Service, String> rule = new NotNullRule<>(PropertyRef.of("name", Service::name), "custom");

            assertThat(rule.validate(named(""), "App")).isEmpty();
        }
    }

    @Nested
    @DisplayName("RegexRule")
    class Regex {

        private final RegexRule<Service> rule =
                new RegexRule<>(PropertyRef.of("version", Service::version), "^\\d+\\.\\d+\\.\\d+$", null);

        @Test
        @DisplayName("Should pass for a matching value")
        void shouldPassForMatch() {
            assertThat(rule.validate(new Service("a", "2.10.3", List.of()), "App")).isEmpty();
        }

        @Test
        @DisplayName("Should fail for a non-matching value and show the pattern")
        void shouldFailForMismatch() {
            ConfigValidationError error = rule.validate(new Service("a", "v2", List.of()), "App").orElseThrow();

            assertThat(error.message()).isEqualTo("version does not match required pattern");
            assertThat(error.currentValue()).isEqualTo("v2");
            assertThat(error.suggestions()).contains("Required pattern: ^\\d+\\.\\d+\\.\\d+$");
        }

        @Test
        @DisplayName("Should treat a missing value as no violation")
        void shouldPassForNull() {
            assertThat(rule.validate(new Service("a", null, List.of()), "App")).isEmpty();
        }

        @Test
        @DisplayName("Should search anywhere in the value for unanchored patterns")
        void shouldSearchUnanchored() {
            RegexRule<Service> encrypt = new RegexRule<>(PropertyRef.of("name", Service::name), "Encrypt=True|Encrypt=true", null);

            assertThat(encrypt.validate(named("Server=db;Encrypt=True;"), "Db")).isEmpty();
            assertThat(encrypt.validate(named("Server=db;"), "Db")).isPresent();
        }

        @Test
        @DisplayName("Should reject an invalid pattern at construction")
        void shouldRejectInvalidPattern() {
            assertThatThrownBy(() -> new RegexRule<>(PropertyRef.of("name", Service::name), "([a-z", null))
                    .isInstanceOf(PatternSyntaxException.class);
        }
    }
}
