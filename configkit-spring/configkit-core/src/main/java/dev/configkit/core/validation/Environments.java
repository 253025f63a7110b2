package dev.configkit.core.validation;

import java.util.Optional;

/**
 * Resolves the name of the environment the application runs in.
 * <p>
 * Lookup order: system property {@value #ENVIRONMENT_PROPERTY}, environment variable
 * {@value #ENVIRONMENT_VARIABLE}, then {@value #PRODUCTION}.
 */
public final class Environments {

    public static final String ENVIRONMENT_PROPERTY = "configkit.environment";
    public static final String ENVIRONMENT_VARIABLE = "CONFIGKIT_ENVIRONMENT";

    public static final String DEVELOPMENT = "Development";
    public static final String STAGING = "Staging";
    public static final String PRODUCTION = "Production";

    private Environments() {
    }

    public static String current() {
        return nonBlank(System.getProperty(ENVIRONMENT_PROPERTY))
                .or(() -> nonBlank(System.getenv(ENVIRONMENT_VARIABLE)))
                .orElse(PRODUCTION);
    }

    private static Optional<String> nonBlank(String value) {
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }
}
