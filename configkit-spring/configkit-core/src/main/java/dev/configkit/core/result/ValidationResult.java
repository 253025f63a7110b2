package dev.configkit.core.result;

import java.util.List;
import java.util.Optional;

/**
 * Either a validated configuration object or the errors that rejected it.
 *
 * @param valid  whether validation passed
 * @param value  the validated instance, {@code null} on failure
 * @param errors error codes and messages, empty on success
 * @param <T>    the configuration type
 */
public record ValidationResult<T>(boolean valid, T value, List<ResultError> errors) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        if (valid && !errors.isEmpty()) {
            throw new IllegalArgumentException("A successful result must not carry errors");
        }
        if (!valid && errors.isEmpty()) {
            throw new IllegalArgumentException("A failed result needs at least one error");
        }
    }

    public static <T> ValidationResult<T> success(T value) {
        return new ValidationResult<>(true, value, List.of());
    }

    public static <T> ValidationResult<T> failure(List<ResultError> errors) {
        return new ValidationResult<>(false, null, errors);
    }

    public static <T> ValidationResult<T> failure(ResultError error) {
        return failure(List.of(error));
    }

    public Optional<T> asOptional() {
        return valid ? Optional.ofNullable(value) : Optional.empty();
    }

    public Optional<ResultError> firstError() {
        return errors.stream().findFirst();
    }
}
