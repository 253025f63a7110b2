package dev.configkit.core.security;

/**
 * Expected storage formats for secret-bearing configuration values.
 */
public enum SecretFormat {
    /**
     * Azure Key Vault reference: {@code @Microsoft.KeyVault(SecretUri=...)}.
     */
    AZURE_KEY_VAULT,

    /**
     * AWS Secrets Manager ARN: {@code arn:aws:secretsmanager:...}.
     */
    AWS_SECRETS_MANAGER,

    /**
     * Environment variable placeholder: {@code ${VARIABLE_NAME}}.
     */
    ENVIRONMENT_VARIABLE,

    /**
     * Any value that does not look like a plain-text secret, i.e. the secret has been
     * moved out of the configuration file.
     */
    EXTERNALIZED
}
