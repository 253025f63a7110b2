package dev.configkit.core.validation.rules;

import dev.configkit.core.ConfigValidationError;
import dev.configkit.core.security.SecurityLevel;
import dev.configkit.core.validation.PropertyRef;
import dev.configkit.core.validation.PropertyRule;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Fails when a property still holds a known insecure default such as {@code admin}.
 * <p>
 * Comparison ignores case. The severity level only labels the message.
 */
public final class DefaultValueWarningRule<T> extends PropertyRule<T, String> {

    private final String defaultValue;
    private final SecurityLevel level;

    public DefaultValueWarningRule(PropertyRef<T, String> property, String defaultValue,
                                   SecurityLevel level, String customMessage) {
        super(property, customMessage);
        this.defaultValue = Objects.requireNonNull(defaultValue, "Default value must not be null");
        this.level = Objects.requireNonNull(level, "Security level must not be null");
    }

    @Override
    public Optional<ConfigValidationError> validate(T options, String sectionName) {
        String value = valueOf(options);

        if (defaultValue.equalsIgnoreCase(value)) {
            return Optional.of(new ConfigValidationError(
                    key(sectionName),
                    messageOr("[" + level + "] " + propertyName() + " is using default/insecure value"),
                    REDACTED,
                    List.of(
                            "Change to a secure value",
                            "Default value '" + defaultValue + "' should not be used in production")));
        }

        return Optional.empty();
    }

    public SecurityLevel getLevel() {
        return level;
    }
}
