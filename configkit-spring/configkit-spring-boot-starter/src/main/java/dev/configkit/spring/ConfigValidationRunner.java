package dev.configkit.spring;

import dev.configkit.core.ValidationReport;
import dev.configkit.core.exception.ConfigValidationException;
import dev.configkit.core.validation.ConfigValidationBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs every registered {@link ConfigValidationBuilder} against the beans of its target type
 * once all singletons are created.
 * <p>
 * Invalid configuration aborts startup with a {@link ConfigValidationException} carrying every
 * error of the first failing section, unless {@code configkit.fail-on-error} is false.
 */
public class ConfigValidationRunner implements SmartInitializingSingleton {

    private static final Logger logger = LoggerFactory.getLogger(ConfigValidationRunner.class);

    private final ObjectProvider<ConfigValidationBuilder<?>> builders;
    private final ListableBeanFactory beanFactory;
    private final ConfigKitProperties properties;

    public ConfigValidationRunner(ObjectProvider<ConfigValidationBuilder<?>> builders,
                                  ListableBeanFactory beanFactory,
                                  ConfigKitProperties properties) {
        this.builders = builders;
        this.beanFactory = beanFactory;
        this.properties = properties;
    }

    @Override
    public void afterSingletonsInstantiated() {
        List<ValidationReport> reports = validateAll();

        for (ValidationReport report : reports) {
            if (report.valid()) {
                logger.info("Configuration section '{}' ({}) is valid",
                        report.sectionName(), report.configurationType().getSimpleName());
                continue;
            }

            logger.error("Configuration section '{}' ({}) has {} error(s):{}{}",
                    report.sectionName(), report.configurationType().getSimpleName(),
                    report.errors().size(), System.lineSeparator(), report.toText());

            if (properties.isFailOnError()) {
                throw new ConfigValidationException(
                        report.sectionName(), report.configurationType(), report.errors());
            }
            logger.warn("Continuing startup with invalid configuration section '{}' (configkit.fail-on-error=false)",
                    report.sectionName());
        }
    }

    /**
     * Validate every bean that a registered builder targets.
     *
     * @return one report per builder and matching bean, in builder order
     */
    public List<ValidationReport> validateAll() {
        List<ValidationReport> reports = new ArrayList<>();
        builders.orderedStream().forEach(builder -> reports.addAll(validate(builder)));
        return reports;
    }

    private <T> List<ValidationReport> validate(ConfigValidationBuilder<T> builder) {
        Map<String, T> targets = beanFactory.getBeansOfType(builder.getType());
        if (targets.isEmpty()) {
            logger.debug("No bean of type {} found for section '{}'",
                    builder.getType().getName(), builder.getSectionName());
            return List.of();
        }

        List<ValidationReport> reports = new ArrayList<>(targets.size());
        targets.forEach((beanName, bean) -> {
            logger.debug("Validating bean '{}' against section '{}' ({} rules)",
                    beanName, builder.getSectionName(), builder.ruleCount());
            reports.add(ValidationReport.of(builder, bean));
        });
        return reports;
    }
}
