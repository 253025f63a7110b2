package dev.configkit.core;

import dev.configkit.core.validation.ConfigValidationBuilder;

/**
 * Entry point for declaring configuration validations.
 */
public final class ConfigKit {

    private ConfigKit() {
    }

    /**
     * Start a validation for a configuration type, using the simple class name as section name.
     */
    public static <T> ConfigValidationBuilder<T> validate(Class<T> type) {
        return new ConfigValidationBuilder<>(type, type.getSimpleName());
    }

    /**
     * Start a validation for a configuration type bound from the given section.
     */
    public static <T> ConfigValidationBuilder<T> validate(Class<T> type, String sectionName) {
        return new ConfigValidationBuilder<>(type, sectionName);
    }
}
