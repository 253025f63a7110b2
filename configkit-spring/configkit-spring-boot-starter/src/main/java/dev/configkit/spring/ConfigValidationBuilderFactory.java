package dev.configkit.spring;

import dev.configkit.core.ConfigKit;
import dev.configkit.core.validation.ConfigValidationBuilder;

import java.util.Objects;

/**
 * Creates validation builders bound to the environment resolved for this application.
 * <p>
 * Declare builder beans through this factory so that {@code whenDevelopment},
 * {@code whenProduction} and friends follow {@code configkit.environment} and the active profiles:
 * <pre>
 * &#64;Bean
 * ConfigValidationBuilder&lt;DatabaseProperties&gt; databaseValidation(ConfigValidationBuilderFactory configKit) {
 *     return configKit.validate(DatabaseProperties.class, "Database")
 *             .notEmpty("connectionString", DatabaseProperties::getConnectionString);
 * }
 * </pre>
 */
public class ConfigValidationBuilderFactory {

    private final String environmentName;

    public ConfigValidationBuilderFactory(String environmentName) {
        this.environmentName = Objects.requireNonNull(environmentName, "Environment name must not be null");
    }

    public <T> ConfigValidationBuilder<T> validate(Class<T> type) {
        return ConfigKit.validate(type).withEnvironment(environmentName);
    }

    public <T> ConfigValidationBuilder<T> validate(Class<T> type, String sectionName) {
        return ConfigKit.validate(type, sectionName).withEnvironment(environmentName);
    }

    public String getEnvironmentName() {
        return environmentName;
    }
}
