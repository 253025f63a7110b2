package dev.configkit.core.validation.rules;

import dev.configkit.core.ConfigValidationError;
import dev.configkit.core.validation.PropertyRef;
import dev.configkit.core.validation.PropertyRule;

import java.util.Optional;

/**
 * Fails when a property of any type is {@code null}.
 */
public final class NotNullRule<T, V> extends PropertyRule<T, V> {

    public NotNullRule(PropertyRef<T, V> property, String customMessage) {
        super(property, customMessage);
    }

    @Override
    public Optional<ConfigValidationError> validate(T options, String sectionName) {
        if (valueOf(options) == null) {
            return Optional.of(new ConfigValidationError(
                    key(sectionName),
                    messageOr(propertyName() + " must not be null"),
                    null,
                    missingValueSuggestions(sectionName)));
        }

        return Optional.empty();
    }
}
