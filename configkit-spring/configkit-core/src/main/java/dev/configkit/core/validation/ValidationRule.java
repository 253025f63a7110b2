package dev.configkit.core.validation;

import dev.configkit.core.ConfigValidationError;

import java.util.Optional;

/**
 * A single validation check against a configuration object.
 * <p>
 * Implementations must not mutate the validated object and must report failures through
 * the returned error rather than by throwing.
 *
 * @param <T> the configuration type
 */
@FunctionalInterface
public interface ValidationRule<T> {

    /**
     * Validate the configuration object.
     *
     * @param options     the configuration instance
     * @param sectionName the configuration section the instance was bound from
     * @return the validation error, or empty if the check passed
     */
    Optional<ConfigValidationError> validate(T options, String sectionName);
}
