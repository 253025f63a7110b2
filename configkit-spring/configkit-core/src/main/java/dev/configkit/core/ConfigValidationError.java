package dev.configkit.core;

import java.util.List;
import java.util.Objects;

/**
 * A single configuration validation failure.
 *
 * @param key          configuration key in the form {@code section:property}
 * @param message      human-readable error message
 * @param currentValue the offending value, possibly redacted; {@code null} when not applicable
 * @param suggestions  remediation hints, in display order
 */
public record ConfigValidationError(String key, String message, Object currentValue, List<String> suggestions) {

    public ConfigValidationError {
        Objects.requireNonNull(key, "Error key must not be null");
        Objects.requireNonNull(message, "Error message must not be null");
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public ConfigValidationError(String key, String message) {
        this(key, message, null, List.of());
    }

    public ConfigValidationError(String key, String message, Object currentValue) {
        this(key, message, currentValue, List.of());
    }

    /**
     * Render the error for console or log output.
     * <p>
     * The first line carries the key and message, followed by an optional current value
     * line and one line per suggestion.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("  ✗ ").append(key).append(": ").append(message).append(System.lineSeparator());

        if (currentValue != null) {
            sb.append("    Current value: ").append(currentValue).append(System.lineSeparator());
        }

        for (String suggestion : suggestions) {
            sb.append("    → ").append(suggestion).append(System.lineSeparator());
        }

        return sb.toString();
    }
}
