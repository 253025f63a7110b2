package dev.configkit.core.result;

import dev.configkit.core.ConfigValidationError;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A validation error reduced to an error code and message.
 *
 * @param code    error code, e.g. {@code VALIDATION_DATABASE_CONNECTIONSTRING}
 * @param message the error message, unchanged
 */
public record ResultError(String code, String message) {

    public static final String CODE_PREFIX = "VALIDATION_";

    public ResultError {
        Objects.requireNonNull(code, "Error code must not be null");
        Objects.requireNonNull(message, "Error message must not be null");
    }

    /**
     * Derive the error code from the error key: path separators become underscores and the
     * result is upper-cased and prefixed.
     */
    public static ResultError from(ConfigValidationError error) {
        Objects.requireNonNull(error, "Error must not be null");
        String code = CODE_PREFIX + error.key()
                .replace('.', '_')
                .replace(':', '_')
                .toUpperCase(Locale.ROOT);
        return new ResultError(code, error.message());
    }

    public static List<ResultError> fromAll(List<ConfigValidationError> errors) {
        return errors.stream().map(ResultError::from).toList();
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
