package dev.configkit.core.exception;

import dev.configkit.core.ConfigValidationError;

import java.util.List;

/**
 * Exception thrown when a configuration object fails validation and the caller decided
 * that the failure is fatal.
 * <p>
 * The builder itself never throws this; startup integrations do.
 */
public class ConfigValidationException extends ConfigKitException {

    private final String sectionName;
    private final Class<?> configurationType;
    private final List<ConfigValidationError> errors;

    public ConfigValidationException(String sectionName, Class<?> configurationType,
                                     List<ConfigValidationError> errors) {
        super(buildMessage(sectionName, errors));
        this.sectionName = sectionName;
        this.configurationType = configurationType;
        this.errors = List.copyOf(errors);
    }

    public String getSectionName() {
        return sectionName;
    }

    public Class<?> getConfigurationType() {
        return configurationType;
    }

    public List<ConfigValidationError> getErrors() {
        return errors;
    }

    private static String buildMessage(String sectionName, List<ConfigValidationError> errors) {
        StringBuilder sb = new StringBuilder()
                .append("Configuration validation failed for section '")
                .append(sectionName)
                .append("' (")
                .append(errors.size())
                .append(errors.size() == 1 ? " error):" : " errors):")
                .append(System.lineSeparator());
        errors.forEach(sb::append);
        return sb.toString();
    }
}
