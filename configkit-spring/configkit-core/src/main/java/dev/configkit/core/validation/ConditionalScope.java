package dev.configkit.core.validation;

import java.util.function.Predicate;

/**
 * Handle for an open conditional scope on a {@link ConfigValidationBuilder}.
 * <p>
 * Every rule registered between {@link ConfigValidationBuilder#beginConditionalScope(Predicate)}
 * and {@link ConfigValidationBuilder#endConditionalScope(ConditionalScope)} is gated by the
 * scope's condition.
 *
 * @param <T> the configuration type
 */
public final class ConditionalScope<T> {

    private final Predicate<? super T> condition;
    private final int firstRuleIndex;

    ConditionalScope(Predicate<? super T> condition, int firstRuleIndex) {
        this.condition = condition;
        this.firstRuleIndex = firstRuleIndex;
    }

    Predicate<? super T> condition() {
        return condition;
    }

    int firstRuleIndex() {
        return firstRuleIndex;
    }
}
