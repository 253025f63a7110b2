package dev.configkit.core.exception;

/**
 * Base exception for ConfigKit errors.
 */
public class ConfigKitException extends RuntimeException {

    public ConfigKitException(String message) {
        super(message);
    }

    public ConfigKitException(String message, Throwable cause) {
        super(message, cause);
    }
}
