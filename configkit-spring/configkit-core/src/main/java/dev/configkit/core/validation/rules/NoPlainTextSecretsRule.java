package dev.configkit.core.validation.rules;

import dev.configkit.core.ConfigValidationError;
import dev.configkit.core.security.SecretDetector;
import dev.configkit.core.validation.PropertyRef;
import dev.configkit.core.validation.PropertyRule;

import java.util.List;
import java.util.Optional;

/**
 * Fails when a secret-bearing property holds what looks like a plain-text secret.
 *
 * @see SecretDetector#isLikelySecret(String, String)
 */
public final class NoPlainTextSecretsRule<T> extends PropertyRule<T, String> {

    public NoPlainTextSecretsRule(PropertyRef<T, String> property, String customMessage) {
        super(property, customMessage);
    }

    @Override
    public Optional<ConfigValidationError> validate(T options, String sectionName) {
        String value = valueOf(options);

        if (!isBlank(value) && SecretDetector.isLikelySecret(value, propertyName())) {
            return Optional.of(new ConfigValidationError(
                    key(sectionName),
                    messageOr(propertyName() + " appears to contain a plain-text secret"),
                    REDACTED,
                    List.of(
                            "Use Azure Key Vault: @Microsoft.KeyVault(SecretUri=...)",
                            "Use AWS Secrets Manager: arn:aws:secretsmanager:...",
                            "Use environment variables for sensitive data: ${VARIABLE_NAME}")));
        }

        return Optional.empty();
    }
}
