package dev.configkit.core.validation.rules;

import dev.configkit.core.ConfigValidationError;
import dev.configkit.core.validation.PropertyRef;
import dev.configkit.core.validation.PropertyRule;

import java.util.Optional;

/**
 * Fails when a string property is {@code null}, empty or whitespace only.
 */
public final class NotEmptyRule<T> extends PropertyRule<T, String> {

    public NotEmptyRule(PropertyRef<T, String> property, String customMessage) {
        super(property, customMessage);
    }

    @Override
    public Optional<ConfigValidationError> validate(T options, String sectionName) {
        String value = valueOf(options);

        if (isBlank(value)) {
            return Optional.of(new ConfigValidationError(
                    key(sectionName),
                    messageOr(propertyName() + " must not be empty"),
                    value,
                    missingValueSuggestions(sectionName)));
        }

        return Optional.empty();
    }
}
