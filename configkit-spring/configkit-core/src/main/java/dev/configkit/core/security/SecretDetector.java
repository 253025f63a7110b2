package dev.configkit.core.security;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Heuristic detection of plain-text secrets in configuration values.
 * <p>
 * Only properties whose name contains one of a fixed set of keywords (password, token,
 * api key, ...) are inspected. Values that point at external secret storage are never
 * reported.
 */
public final class SecretDetector {

    private static final String KEY_VAULT_PREFIX = "@Microsoft.KeyVault";
    private static final String SECRETS_MANAGER_PREFIX = "arn:aws:secretsmanager";
    private static final String PLACEHOLDER_PREFIX = "${";

    private static final List<String> SECRET_KEYWORDS = List.of(
            "password", "passwd", "pwd", "secret", "token", "apikey", "api_key",
            "private_key", "privatekey", "client_secret", "clientsecret");

    // Whole-value patterns
    private static final Pattern OPENAI_API_KEY = Pattern.compile("^sk-[a-zA-Z0-9]{20,}$");
    private static final Pattern GENERIC_TOKEN = Pattern.compile("^[a-zA-Z0-9]{32,}$");
    private static final Pattern BEARER_TOKEN = Pattern.compile("^Bearer\\s+[a-zA-Z0-9\\-._~+/]+=*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern HEX_64 = Pattern.compile("^[a-f0-9]{64}$");
    private static final Pattern GOOGLE_API_KEY = Pattern.compile("^AIza[0-9A-Za-z\\-_]{35}$");

    // Matched anywhere in the value; access key ids are often embedded in longer strings
    private static final Pattern AWS_ACCESS_KEY = Pattern.compile("AKIA[0-9A-Z]{16}");

    private static final List<Pattern> SECRET_PATTERNS = List.of(
            OPENAI_API_KEY, GENERIC_TOKEN, BEARER_TOKEN, HEX_64, GOOGLE_API_KEY, AWS_ACCESS_KEY);

    private SecretDetector() {
    }

    /**
     * Check whether a value looks like a plain-text secret.
     *
     * @param value        the configuration value, may be {@code null}
     * @param propertyName name of the property holding the value
     * @return {@code true} if the property is secret-bearing and the value has a secret shape
     */
    public static boolean isLikelySecret(String value, String propertyName) {
        Objects.requireNonNull(propertyName, "Property name must not be null");

        if (value == null || value.isBlank()) {
            return false;
        }

        String lowerName = propertyName.toLowerCase(Locale.ROOT);
        if (SECRET_KEYWORDS.stream().noneMatch(lowerName::contains)) {
            return false;
        }

        if (isSecureReference(value)) {
            return false;
        }

        return SECRET_PATTERNS.stream().anyMatch(pattern -> pattern.matcher(value).find());
    }

    /**
     * Check whether a value is a reference to externally stored secret material.
     * <p>
     * The placeholder check only looks at the opening {@code ${}; a closing brace is not required.
     *
     * @param value the value to check
     * @return {@code true} for Key Vault references, Secrets Manager ARNs and {@code ${...}} placeholders
     */
    public static boolean isSecureReference(String value) {
        Objects.requireNonNull(value, "Value must not be null");

        return isKeyVaultReference(value)
                || isSecretsManagerArn(value)
                || value.startsWith(PLACEHOLDER_PREFIX);
    }

    public static boolean isKeyVaultReference(String value) {
        return startsWithIgnoreCase(value, KEY_VAULT_PREFIX);
    }

    public static boolean isSecretsManagerArn(String value) {
        return startsWithIgnoreCase(value, SECRETS_MANAGER_PREFIX);
    }

    private static boolean startsWithIgnoreCase(String value, String prefix) {
        return value.regionMatches(true, 0, prefix, 0, prefix.length());
    }
}
