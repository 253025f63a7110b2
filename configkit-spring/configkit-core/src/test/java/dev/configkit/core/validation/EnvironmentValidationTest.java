package dev.configkit.core.validation;

import dev.configkit.core.ConfigKit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for environment-specific blocks on {@link ConfigValidationBuilder}.
 */
class EnvironmentValidationTest {

    @AfterEach
    void clearProperty() {
        System.clearProperty(Environments.ENVIRONMENT_PROPERTY);
    }

    @Test
    @DisplayName("Should register rules for the matching environment only")
    void shouldRegisterForMatchingEnvironment() {
        ConfigValidationBuilder<Settings> builder = ConfigKit.validate(Settings.class, "Settings")
                .withEnvironment("Development")
                .whenDevelopment(dev -> dev.notEmpty("value", Settings::value, "development"))
                .whenProduction(prod -> prod.notEmpty("value", Settings::value, "production"))
                .whenStaging(staging -> staging.notEmpty("value", Settings::value, "staging"));

        assertThat(builder.ruleCount()).isEqualTo(1);
        assertThat(builder.errors(new Settings(""))).singleElement()
                .satisfies(error -> assertThat(error.message()).isEqualTo("development"));
    }

    @Test
    @DisplayName("Should compare environment names ignoring case")
    void shouldIgnoreCase() {
        ConfigValidationBuilder<Settings> builder = ConfigKit.validate(Settings.class, "Settings")
                .withEnvironment("qa")
                .whenEnvironment("QA", qa -> qa.notEmpty("value", Settings::value));

        assertThat(builder.ruleCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should read the environment from the system property")
    void shouldReadSystemProperty() {
        System.setProperty(Environments.ENVIRONMENT_PROPERTY, "Staging");

        ConfigValidationBuilder<Settings> builder = ConfigKit.validate(Settings.class, "Settings")
                .whenStaging(staging -> staging.notEmpty("value", Settings::value));

        assertThat(builder.currentEnvironment()).isEqualTo("Staging");
        assertThat(builder.ruleCount()).isEqualTo(1);
    }

    record Settings(String value) {
    }
}
