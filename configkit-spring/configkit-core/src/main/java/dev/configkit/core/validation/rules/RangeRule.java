package dev.configkit.core.validation.rules;

import dev.configkit.core.validation.PropertyRef;

import java.util.Objects;

/**
 * Inclusive range check: {@code minimum <= value <= maximum}.
 */
public final class RangeRule<T, V extends Comparable<? super V>> extends ComparableRule<T, V> {

    private final V minimum;
    private final V maximum;

    public RangeRule(PropertyRef<T, V> property, V minimum, V maximum, String customMessage) {
        super(property, customMessage);
        this.minimum = Objects.requireNonNull(minimum, "Minimum must not be null");
        this.maximum = Objects.requireNonNull(maximum, "Maximum must not be null");
        if (minimum.compareTo(maximum) > 0) {
            throw new IllegalArgumentException("Range minimum " + minimum + " is greater than maximum " + maximum);
        }
    }

    @Override
    protected boolean accepts(V value) {
        return value.compareTo(minimum) >= 0 && value.compareTo(maximum) <= 0;
    }

    @Override
    protected String describeBound() {
        return "between " + minimum + " and " + maximum;
    }

    @Override
    protected String suggestBound() {
        return "Valid range: " + minimum + "-" + maximum;
    }
}
