package dev.configkit.core.result;

import dev.configkit.core.ConfigValidationError;
import dev.configkit.core.validation.ConfigValidationBuilder;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Adapts builder output to {@link ValidationResult}.
 */
public final class ValidationResults {

    private ValidationResults() {
    }

    /**
     * Validate and keep only the first error. Rules after the first failing one are not run.
     */
    public static <T> ValidationResult<T> toResult(ConfigValidationBuilder<T> builder, T options) {
        Objects.requireNonNull(builder, "Builder must not be null");
        Objects.requireNonNull(options, "Options must not be null");

        Optional<ConfigValidationError> first = builder.validate(options).findFirst();
        return first.<ValidationResult<T>>map(error -> ValidationResult.failure(ResultError.from(error)))
                .orElseGet(() -> ValidationResult.success(options));
    }

    /**
     * Validate and keep every error.
     */
    public static <T> ValidationResult<T> toErrorsResult(ConfigValidationBuilder<T> builder, T options) {
        Objects.requireNonNull(builder, "Builder must not be null");
        Objects.requireNonNull(options, "Options must not be null");

        List<ConfigValidationError> errors = builder.errors(options);
        if (errors.isEmpty()) {
            return ValidationResult.success(options);
        }
        return ValidationResult.failure(toResultErrors(errors));
    }

    public static List<ResultError> toResultErrors(List<ConfigValidationError> errors) {
        Objects.requireNonNull(errors, "Errors must not be null");
        return ResultError.fromAll(errors);
    }
}
