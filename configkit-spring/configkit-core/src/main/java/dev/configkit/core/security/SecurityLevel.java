package dev.configkit.core.security;

/**
 * Severity label attached to default-value warnings.
 */
public enum SecurityLevel {
    CRITICAL,
    WARNING,
    INFO
}
