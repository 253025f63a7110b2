package dev.configkit.spring;

import dev.configkit.core.validation.ConfigValidationBuilder;
import dev.configkit.core.validation.Environments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;

/**
 * Auto-configuration for ConfigKit startup validation.
 */
@AutoConfiguration
@EnableConfigurationProperties(ConfigKitProperties.class)
@ConditionalOnProperty(prefix = "configkit", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ConfigKitAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(ConfigKitAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public ConfigValidationBuilderFactory configValidationBuilderFactory(ConfigKitProperties properties,
                                                                         Environment environment) {
        String environmentName = resolveEnvironment(properties, environment);
        logger.info("Creating ConfigValidationBuilderFactory for environment: {}", environmentName);
        return new ConfigValidationBuilderFactory(environmentName);
    }

    @Bean
    @ConditionalOnMissingBean
    public ConfigValidationRunner configValidationRunner(ObjectProvider<ConfigValidationBuilder<?>> builders,
                                                         ListableBeanFactory beanFactory,
                                                         ConfigKitProperties properties) {
        logger.info("Registering configuration validation runner (fail-on-error={})", properties.isFailOnError());
        return new ConfigValidationRunner(builders, beanFactory, properties);
    }

    static String resolveEnvironment(ConfigKitProperties properties, Environment environment) {
        if (StringUtils.hasText(properties.getEnvironment())) {
            return properties.getEnvironment();
        }
        String[] activeProfiles = environment.getActiveProfiles();
        if (activeProfiles.length > 0) {
            return activeProfiles[0];
        }
        return Environments.current();
    }
}
