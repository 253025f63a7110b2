package dev.configkit.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for ConfigKit startup validation.
 */
@ConfigurationProperties(prefix = "configkit")
public class ConfigKitProperties {

    /**
     * Enable/disable validation of configuration beans on startup.
     */
    private boolean enabled = true;

    /**
     * Abort startup when a configuration bean is invalid. When false, errors are logged only.
     */
    private boolean failOnError = true;

    /**
     * Environment name for environment-conditional rules. Defaults to the first active
     * profile, then to the {@code configkit.environment} system property, the
     * {@code CONFIGKIT_ENVIRONMENT} variable and finally "Production".
     */
    private String environment;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isFailOnError() {
        return failOnError;
    }

    public void setFailOnError(boolean failOnError) {
        this.failOnError = failOnError;
    }

    public String getEnvironment() {
        return environment;
    }

    public void setEnvironment(String environment) {
        this.environment = environment;
    }
}
