package dev.configkit.spring;

import dev.configkit.core.ConfigValidationError;
import dev.configkit.core.exception.ConfigValidationException;
import org.springframework.boot.diagnostics.AbstractFailureAnalyzer;
import org.springframework.boot.diagnostics.FailureAnalysis;

import java.util.stream.Collectors;

/**
 * Reports a {@link ConfigValidationException} as a startup failure listing every invalid key.
 */
public class ConfigValidationFailureAnalyzer extends AbstractFailureAnalyzer<ConfigValidationException> {

    @Override
    protected FailureAnalysis analyze(Throwable rootFailure, ConfigValidationException cause) {
        StringBuilder description = new StringBuilder()
                .append("Configuration section '")
                .append(cause.getSectionName())
                .append("' bound to ")
                .append(cause.getConfigurationType().getName())
                .append(" is invalid:")
                .append(System.lineSeparator())
                .append(System.lineSeparator());
        cause.getErrors().forEach(description::append);

        String keys = cause.getErrors().stream()
                .map(ConfigValidationError::key)
                .distinct()
                .collect(Collectors.joining(", "));

        return new FailureAnalysis(description.toString(),
                "Update your application's configuration for: " + keys, cause);
    }
}
