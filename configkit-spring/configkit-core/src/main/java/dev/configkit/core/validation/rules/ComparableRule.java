package dev.configkit.core.validation.rules;

import dev.configkit.core.ConfigValidationError;
import dev.configkit.core.validation.PropertyRef;
import dev.configkit.core.validation.PropertyRule;

import java.util.List;
import java.util.Optional;

/**
 * Base class for threshold checks over any {@link Comparable} property type.
 * <p>
 * Numbers, dates, instants and durations all go through {@link Comparable#compareTo}.
 * A {@code null} value never satisfies a bound.
 */
abstract class ComparableRule<T, V extends Comparable<? super V>> extends PropertyRule<T, V> {

    protected ComparableRule(PropertyRef<T, V> property, String customMessage) {
        super(property, customMessage);
    }

    @Override
    public final Optional<ConfigValidationError> validate(T options, String sectionName) {
        V value = valueOf(options);

        if (value != null && accepts(value)) {
            return Optional.empty();
        }

        return Optional.of(new ConfigValidationError(
                key(sectionName),
                messageOr(propertyName() + " must be " + describeBound() + " (current: " + value + ")"),
                value,
                List.of(suggestBound(), "Current value: " + value)));
    }

    /**
     * Whether a non-null value satisfies the bound.
     */
    protected abstract boolean accepts(V value);

    /**
     * Bound as it appears in the default message, e.g. {@code > 0}.
     */
    protected abstract String describeBound();

    protected abstract String suggestBound();
}
