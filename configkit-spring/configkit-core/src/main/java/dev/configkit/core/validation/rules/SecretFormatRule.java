package dev.configkit.core.validation.rules;

import dev.configkit.core.ConfigValidationError;
import dev.configkit.core.security.SecretDetector;
import dev.configkit.core.security.SecretFormat;
import dev.configkit.core.validation.PropertyRef;
import dev.configkit.core.validation.PropertyRule;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Fails when a secret value is not stored in exactly the expected format.
 * <p>
 * A value in a different secure format than the one requested still fails. Blank values pass.
 */
public final class SecretFormatRule<T> extends PropertyRule<T, String> {

    private final SecretFormat expectedFormat;

    public SecretFormatRule(PropertyRef<T, String> property, SecretFormat expectedFormat, String customMessage) {
        super(property, customMessage);
        this.expectedFormat = Objects.requireNonNull(expectedFormat, "Expected format must not be null");
    }

    @Override
    public Optional<ConfigValidationError> validate(T options, String sectionName) {
        String value = valueOf(options);

        if (isBlank(value) || matchesFormat(value)) {
            return Optional.empty();
        }

        return Optional.of(new ConfigValidationError(
                key(sectionName),
                messageOr(propertyName() + " does not follow " + expectedFormat + " format"),
                REDACTED,
                List.of(formatSuggestion())));
    }

    private boolean matchesFormat(String value) {
        return switch (expectedFormat) {
            case AZURE_KEY_VAULT -> SecretDetector.isKeyVaultReference(value);
            case AWS_SECRETS_MANAGER -> SecretDetector.isSecretsManagerArn(value);
            case ENVIRONMENT_VARIABLE -> value.startsWith("${") && value.endsWith("}");
            case EXTERNALIZED -> !SecretDetector.isLikelySecret(value, propertyName());
        };
    }

    private String formatSuggestion() {
        return switch (expectedFormat) {
            case AZURE_KEY_VAULT -> "Use format: @Microsoft.KeyVault(SecretUri=https://...)";
            case AWS_SECRETS_MANAGER -> "Use format: arn:aws:secretsmanager:region:account:secret:name";
            case ENVIRONMENT_VARIABLE -> "Use format: ${VARIABLE_NAME}";
            case EXTERNALIZED -> "Move the secret out of the configuration file into a secret store or environment variable";
        };
    }
}
