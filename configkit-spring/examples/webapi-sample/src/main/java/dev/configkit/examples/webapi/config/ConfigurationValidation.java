package dev.configkit.examples.webapi.config;

import dev.configkit.core.security.SecretFormat;
import dev.configkit.core.security.SecurityLevel;
import dev.configkit.core.validation.ConfigValidationBuilder;
import dev.configkit.spring.ConfigValidationBuilderFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;

/**
 * Validation rules for every configuration section of the sample. Each builder runs against
 * its bound properties bean on startup.
 */
@Configuration(proxyBeanMethods = false)
public class ConfigurationValidation {

    @Bean
    public ConfigValidationBuilder<ApplicationProperties> applicationValidation(ConfigValidationBuilderFactory configKit) {
        return configKit.validate(ApplicationProperties.class, "Application")
                .notEmpty("name", ApplicationProperties::getName, "Application name is required")
                .matchesPattern("version", ApplicationProperties::getVersion, "^\\d+\\.\\d+\\.\\d+$",
                        "Version must be in format X.Y.Z")
                .minimum("maxConcurrentRequests", ApplicationProperties::getMaxConcurrentRequests, 1,
                        "Max concurrent requests must be at least 1")
                .maximum("maxConcurrentRequests", ApplicationProperties::getMaxConcurrentRequests, 1000,
                        "Max concurrent requests cannot exceed 1000")
                .inRange("requestTimeoutSeconds", ApplicationProperties::getRequestTimeoutSeconds, 5, 300,
                        "Request timeout must be between 5 and 300 seconds");
    }

    @Bean
    public ConfigValidationBuilder<DatabaseProperties> databaseValidation(ConfigValidationBuilderFactory configKit) {
        return configKit.validate(DatabaseProperties.class, "Database")
                .notEmpty("connectionString", DatabaseProperties::getConnectionString,
                        "Database connection string is required")
                .inRange("commandTimeoutSeconds", DatabaseProperties::getCommandTimeoutSeconds, 1, 600,
                        "Command timeout must be between 1 and 600 seconds")
                .inRange("maxPoolSize", DatabaseProperties::getMaxPoolSize, 1, 1000,
                        "Max pool size must be between 1 and 1000")
                .when(DatabaseProperties::isRequireSsl, b -> b
                        .matchesPattern("connectionString", DatabaseProperties::getConnectionString,
                                "Encrypt=True|Encrypt=true",
                                "SSL is required but connection string does not specify Encrypt=True"))
                .whenDevelopment(b -> b
                        .warnIfDefaultValue("connectionString", DatabaseProperties::getConnectionString,
                                "Server=localhost", SecurityLevel.INFO));
    }

    @Bean
    public ConfigValidationBuilder<ExternalApiProperties> externalApiValidation(ConfigValidationBuilderFactory configKit) {
        return configKit.validate(ExternalApiProperties.class, "ExternalApi")
                .notEmpty("baseUrl", ExternalApiProperties::getBaseUrl, "External API base URL is required")
                .notEmpty("apiKey", ExternalApiProperties::getApiKey, "External API key is required")
                .noPlainTextSecrets("apiKey", ExternalApiProperties::getApiKey,
                        "API key appears to be a plain-text secret")
                .greaterThan("timeoutSeconds", ExternalApiProperties::getTimeoutSeconds, 0,
                        "API timeout must be greater than 0")
                .lessThan("timeoutSeconds", ExternalApiProperties::getTimeoutSeconds, 600,
                        "API timeout must be less than 600 seconds")
                .inRange("maxRetries", ExternalApiProperties::getMaxRetries, 0, 10,
                        "Max retries must be between 0 and 10")
                .whenProduction(b -> b
                        .validateSecretFormat("apiKey", ExternalApiProperties::getApiKey, SecretFormat.EXTERNALIZED)
                        .urlReachable("baseUrl", ExternalApiProperties::getBaseUrl, Duration.ofSeconds(10)));
    }

    @Bean
    public ConfigValidationBuilder<LoggingProperties> loggingValidation(ConfigValidationBuilderFactory configKit) {
        return configKit.validate(LoggingProperties.class, "CustomLogging")
                .notEmpty("logDirectory", LoggingProperties::getLogDirectory, "Log directory path is required")
                .directoryExists("logDirectory", LoggingProperties::getLogDirectory, "Log directory does not exist")
                .matchesPattern("minimumLevel", LoggingProperties::getMinimumLevel,
                        "^(TRACE|DEBUG|INFO|WARN|ERROR)$")
                .inRange("retentionDays", LoggingProperties::getRetentionDays, 1, 365,
                        "Retention days must be between 1 and 365")
                .inRange("maxFileSizeMb", LoggingProperties::getMaxFileSizeMb, 1, 10000,
                        "Max file size must be between 1 and 10000 MB");
    }

    @Bean
    public ConfigValidationBuilder<SecurityProperties> securityValidation(ConfigValidationBuilderFactory configKit) {
        return configKit.validate(SecurityProperties.class, "Security")
                .notEmpty("environment", SecurityProperties::getEnvironment, "Environment is required")
                .noPlainTextSecrets("certificatePassword", SecurityProperties::getCertificatePassword)
                .warnIfDefaultValue("adminPassword", SecurityProperties::getAdminPassword, "admin",
                        SecurityLevel.CRITICAL)
                .when(c -> "Production".equalsIgnoreCase(c.getEnvironment()), b -> b
                        .notEmpty("certificatePath", SecurityProperties::getCertificatePath,
                                "Certificate path is required in production")
                        .fileExists("certificatePath", SecurityProperties::getCertificatePath,
                                "Certificate file does not exist"))
                .when(c -> c.isRequireHttps() && StringUtils.hasText(c.getCertificatePath()), b -> b
                        .fileExists("certificatePath", SecurityProperties::getCertificatePath,
                                "Certificate file must exist when HTTPS is required"));
    }

    @Bean
    public ConfigValidationBuilder<CampaignProperties> campaignValidation(ConfigValidationBuilderFactory configKit) {
        LocalDate today = LocalDate.now();
        return configKit.validate(CampaignProperties.class, "Campaign")
                .notEmpty("name", CampaignProperties::getName, "Campaign name is required")
                .minimum("startDate", CampaignProperties::getStartDate, today, "Campaign must start today or later")
                .greaterThan("endDate", CampaignProperties::getEndDate, today, "Campaign end date must be in the future")
                .minimum("minimumPurchaseAmount", CampaignProperties::getMinimumPurchaseAmount, new BigDecimal("0.01"),
                        "Minimum purchase amount must be at least $0.01")
                .maximum("maximumDiscountPercentage", CampaignProperties::getMaximumDiscountPercentage,
                        new BigDecimal("0.75"), "Discount percentage cannot exceed 75%")
                .greaterThan("emailReminderInterval", CampaignProperties::getEmailReminderInterval, Duration.ZERO,
                        "Email reminder interval must be positive")
                .maximum("cacheDuration", CampaignProperties::getCacheDuration, Duration.ofHours(24),
                        "Cache duration cannot exceed 24 hours");
    }
}
