package dev.configkit.core.validation.rules;

import dev.configkit.core.validation.PropertyRef;

import java.util.Objects;

/**
 * Inclusive lower bound.
 */
public final class MinimumRule<T, V extends Comparable<? super V>> extends ComparableRule<T, V> {

    private final V minimum;

    public MinimumRule(PropertyRef<T, V> property, V minimum, String customMessage) {
        super(property, customMessage);
        this.minimum = Objects.requireNonNull(minimum, "Minimum must not be null");
    }

    @Override
    protected boolean accepts(V value) {
        return value.compareTo(minimum) >= 0;
    }

    @Override
    protected String describeBound() {
        return "at least " + minimum;
    }

    @Override
    protected String suggestBound() {
        return "Must be at least " + minimum;
    }
}
