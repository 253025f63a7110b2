package dev.configkit.core.validation;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Base class for rules that check a single property.
 *
 * @param <T> the configuration type
 * @param <V> the property type
 */
public abstract class PropertyRule<T, V> implements ValidationRule<T> {

    protected static final String REDACTED = "[REDACTED]";

    private final PropertyRef<T, V> property;
    private final String customMessage;

    protected PropertyRule(PropertyRef<T, V> property, String customMessage) {
        this.property = Objects.requireNonNull(property, "Property reference must not be null");
        this.customMessage = customMessage;
    }

    public PropertyRef<T, V> getProperty() {
        return property;
    }

    protected String propertyName() {
        return property.name();
    }

    protected V valueOf(T options) {
        return property.get(options);
    }

    protected String key(String sectionName) {
        return property.keyIn(sectionName);
    }

    /**
     * The custom message if one was supplied, otherwise the rule's default.
     */
    protected String messageOr(String defaultMessage) {
        return customMessage != null ? customMessage : defaultMessage;
    }

    /**
     * Hints telling the user where a missing value can be supplied.
     */
    protected List<String> missingValueSuggestions(String sectionName) {
        String envVar = key(sectionName).replace(":", "_").toUpperCase(Locale.ROOT);
        return List.of(
                "Set environment variable: " + envVar,
                "Or pass a system property: -D" + sectionName + "." + propertyName() + "=<value>",
                "Or update application.yml");
    }

    protected static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
