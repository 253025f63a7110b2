package dev.configkit.examples.webapi.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "database")
public class DatabaseProperties {

    private String connectionString = "";
    private int commandTimeoutSeconds;
    private int maxPoolSize;
    private boolean enableSensitiveDataLogging;
    private boolean requireSsl;

    public String getConnectionString() {
        return connectionString;
    }

    public void setConnectionString(String connectionString) {
        this.connectionString = connectionString;
    }

    public int getCommandTimeoutSeconds() {
        return commandTimeoutSeconds;
    }

    public void setCommandTimeoutSeconds(int commandTimeoutSeconds) {
        this.commandTimeoutSeconds = commandTimeoutSeconds;
    }

    public int getMaxPoolSize() {
        return maxPoolSize;
    }

    public void setMaxPoolSize(int maxPoolSize) {
        this.maxPoolSize = maxPoolSize;
    }

    public boolean isEnableSensitiveDataLogging() {
        return enableSensitiveDataLogging;
    }

    public void setEnableSensitiveDataLogging(boolean enableSensitiveDataLogging) {
        this.enableSensitiveDataLogging = enableSensitiveDataLogging;
    }

    public boolean isRequireSsl() {
        return requireSsl;
    }

    public void setRequireSsl(boolean requireSsl) {
        this.requireSsl = requireSsl;
    }
}
