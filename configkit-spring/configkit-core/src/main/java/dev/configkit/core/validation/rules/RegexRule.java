package dev.configkit.core.validation.rules;

import dev.configkit.core.ConfigValidationError;
import dev.configkit.core.validation.PropertyRef;
import dev.configkit.core.validation.PropertyRule;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Fails when a non-null string does not contain a match for the pattern.
 * <p>
 * Anchor the pattern with {@code ^...$} to require a whole-value match. A {@code null}
 * value passes.
 */
public final class RegexRule<T> extends PropertyRule<T, String> {

    private final Pattern pattern;

    public RegexRule(PropertyRef<T, String> property, String pattern, String customMessage) {
        super(property, customMessage);
        this.pattern = Pattern.compile(Objects.requireNonNull(pattern, "Pattern must not be null"));
    }

    @Override
    public Optional<ConfigValidationError> validate(T options, String sectionName) {
        String value = valueOf(options);

        if (value != null && !pattern.matcher(value).find()) {
            return Optional.of(new ConfigValidationError(
                    key(sectionName),
                    messageOr(propertyName() + " does not match required pattern"),
                    value,
                    List.of("Required pattern: " + pattern.pattern(), "Current value: " + value)));
        }

        return Optional.empty();
    }
}
