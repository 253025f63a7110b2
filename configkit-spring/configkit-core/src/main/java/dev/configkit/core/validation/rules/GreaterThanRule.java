package dev.configkit.core.validation.rules;

import dev.configkit.core.validation.PropertyRef;

import java.util.Objects;

/**
 * Exclusive lower bound.
 */
public final class GreaterThanRule<T, V extends Comparable<? super V>> extends ComparableRule<T, V> {

    private final V minimum;

    public GreaterThanRule(PropertyRef<T, V> property, V minimum, String customMessage) {
        super(property, customMessage);
        this.minimum = Objects.requireNonNull(minimum, "Minimum must not be null");
    }

    @Override
    protected boolean accepts(V value) {
        return value.compareTo(minimum) > 0;
    }

    @Override
    protected String describeBound() {
        return "> " + minimum;
    }

    @Override
    protected String suggestBound() {
        return "Must be greater than " + minimum;
    }
}
