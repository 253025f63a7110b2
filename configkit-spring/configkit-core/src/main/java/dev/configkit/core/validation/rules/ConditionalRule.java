package dev.configkit.core.validation.rules;

import dev.configkit.core.ConfigValidationError;
import dev.configkit.core.validation.ValidationRule;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Applies the inner rule only when the condition holds for the whole configuration object.
 */
public final class ConditionalRule<T> implements ValidationRule<T> {

    private final Predicate<? super T> condition;
    private final ValidationRule<T> innerRule;

    public ConditionalRule(Predicate<? super T> condition, ValidationRule<T> innerRule) {
        this.condition = Objects.requireNonNull(condition, "Condition must not be null");
        this.innerRule = Objects.requireNonNull(innerRule, "Inner rule must not be null");
    }

    @Override
    public Optional<ConfigValidationError> validate(T options, String sectionName) {
        if (!condition.test(options)) {
            return Optional.empty();
        }
        return innerRule.validate(options, sectionName);
    }

    public ValidationRule<T> getInnerRule() {
        return innerRule;
    }
}
