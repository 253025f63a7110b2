package dev.configkit.core.exception;

/**
 * Exception thrown when a rule is declared against a property name that is not a simple
 * member name (nested paths, method calls and expressions are rejected).
 */
public class InvalidPropertyReferenceException extends ConfigKitException {

    private final String propertyName;

    public InvalidPropertyReferenceException(String propertyName) {
        super("Property reference must be a simple member name, got: '" + propertyName + "'");
        this.propertyName = propertyName;
    }

    public String getPropertyName() {
        return propertyName;
    }
}
