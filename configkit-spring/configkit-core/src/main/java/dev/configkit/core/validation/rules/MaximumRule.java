package dev.configkit.core.validation.rules;

import dev.configkit.core.validation.PropertyRef;

import java.util.Objects;

/**
 * Inclusive upper bound.
 */
public final class MaximumRule<T, V extends Comparable<? super V>> extends ComparableRule<T, V> {

    private final V maximum;

    public MaximumRule(PropertyRef<T, V> property, V maximum, String customMessage) {
        super(property, customMessage);
        this.maximum = Objects.requireNonNull(maximum, "Maximum must not be null");
    }

    @Override
    protected boolean accepts(V value) {
        return value.compareTo(maximum) <= 0;
    }

    @Override
    protected String describeBound() {
        return "at most " + maximum;
    }

    @Override
    protected String suggestBound() {
        return "Must be at most " + maximum;
    }
}
