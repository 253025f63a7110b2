package dev.configkit.core.validation;

import dev.configkit.core.exception.InvalidPropertyReferenceException;

import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * A named accessor for one top-level property of a configuration type.
 * <p>
 * The name becomes part of every error key produced for the property, so it is restricted
 * to a simple member name such as {@code maxPoolSize}. Paths ({@code pool.size}), calls
 * ({@code getSize()}) and expressions are rejected at construction.
 *
 * @param name   the property name
 * @param getter function reading the property value
 * @param <T>    the configuration type
 * @param <V>    the property type
 */
public record PropertyRef<T, V>(String name, Function<? super T, ? extends V> getter) {

    private static final Pattern MEMBER_NAME = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    public PropertyRef {
        Objects.requireNonNull(name, "Property name must not be null");
        Objects.requireNonNull(getter, "Property getter must not be null");
        if (!MEMBER_NAME.matcher(name).matches()) {
            throw new InvalidPropertyReferenceException(name);
        }
    }

    public static <T, V> PropertyRef<T, V> of(String name, Function<? super T, ? extends V> getter) {
        return new PropertyRef<>(name, getter);
    }

    public V get(T options) {
        return getter.apply(options);
    }

    /**
     * Error key for this property within a section.
     */
    public String keyIn(String sectionName) {
        return sectionName + ":" + name;
    }
}
