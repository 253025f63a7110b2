package dev.configkit.core.validation;

import dev.configkit.core.ConfigValidationError;
import dev.configkit.core.security.SecretFormat;
import dev.configkit.core.security.SecurityLevel;
import dev.configkit.core.validation.rules.ConditionalRule;
import dev.configkit.core.validation.rules.DefaultValueWarningRule;
import dev.configkit.core.validation.rules.DirectoryExistsRule;
import dev.configkit.core.validation.rules.FileExistsRule;
import dev.configkit.core.validation.rules.GreaterThanRule;
import dev.configkit.core.validation.rules.LessThanRule;
import dev.configkit.core.validation.rules.MaximumRule;
import dev.configkit.core.validation.rules.MinimumRule;
import dev.configkit.core.validation.rules.NoPlainTextSecretsRule;
import dev.configkit.core.validation.rules.NotEmptyRule;
import dev.configkit.core.validation.rules.NotNullRule;
import dev.configkit.core.validation.rules.PortAvailableRule;
import dev.configkit.core.validation.rules.RangeRule;
import dev.configkit.core.validation.rules.RegexRule;
import dev.configkit.core.validation.rules.SecretFormatRule;
import dev.configkit.core.validation.rules.UrlReachableRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Fluent builder collecting validation rules for one configuration type and section.
 * <p>
 * Rules run in registration order and every rule runs on each validation; failures are
 * collected, not short-circuited. Example:
 * <pre>{@code
 * ConfigValidationBuilder<DatabaseProperties> builder = ConfigKit.validate(DatabaseProperties.class, "Database")
 *         .notEmpty("connectionString", DatabaseProperties::getConnectionString)
 *         .inRange("maxPoolSize", DatabaseProperties::getMaxPoolSize, 1, 1000)
 *         .when(DatabaseProperties::isRequireSsl, ssl -> ssl
 *                 .matchesPattern("connectionString", DatabaseProperties::getConnectionString, "(?i)encrypt=true"));
 * }</pre>
 * Building is not thread-safe. Once setup is complete, {@link #validate(Object)} may be called
 * from any number of threads.
 *
 * @param <T> the configuration type
 */
public class ConfigValidationBuilder<T> {

    private static final Logger logger = LoggerFactory.getLogger(ConfigValidationBuilder.class);

    private final Class<T> type;
    private final String sectionName;
    private final List<ValidationRule<T>> rules = new ArrayList<>();
    private final Deque<ConditionalScope<T>> openScopes = new ArrayDeque<>();
    private Supplier<String> environment = Environments::current;

    public ConfigValidationBuilder(Class<T> type, String sectionName) {
        this.type = Objects.requireNonNull(type, "Configuration type must not be null");
        this.sectionName = Objects.requireNonNull(sectionName, "Section name must not be null");
    }

    public Class<T> getType() {
        return type;
    }

    public String getSectionName() {
        return sectionName;
    }

    public int ruleCount() {
        return rules.size();
    }

    /**
     * Add a custom validation rule.
     *
     * @param rule the rule to add
     * @return this builder
     */
    public ConfigValidationBuilder<T> addRule(ValidationRule<T> rule) {
        Objects.requireNonNull(rule, "Rule must not be null");
        rules.add(rule);
        logger.debug("Registered {} #{} for section '{}'", rule.getClass().getSimpleName(), rules.size(), sectionName);
        return this;
    }

    // ------------------------------------------------------------------
    // Validation
    // ------------------------------------------------------------------

    /**
     * Run every rule against the configuration object.
     * <p>
     * The returned stream is lazy; each call returns a new one. Consumers that only need the
     * first error can stop early with {@link Stream#findFirst()}.
     *
     * @param options the configuration instance
     * @return the errors in rule registration order
     */
    public Stream<ConfigValidationError> validate(T options) {
        Objects.requireNonNull(options, "Options must not be null");
        return rules.stream()
                .map(rule -> rule.validate(options, sectionName))
                .flatMap(Optional::stream);
    }

    /**
     * Run every rule and collect the errors.
     */
    public List<ConfigValidationError> errors(T options) {
        return validate(options).toList();
    }

    public boolean isValid(T options) {
        return validate(options).findAny().isEmpty();
    }

    // ------------------------------------------------------------------
    // Basic rules
    // ------------------------------------------------------------------

    public ConfigValidationBuilder<T> notEmpty(String name, Function<? super T, String> getter) {
        return notEmpty(name, getter, null);
    }

    public ConfigValidationBuilder<T> notEmpty(String name, Function<? super T, String> getter, String message) {
        return addRule(new NotEmptyRule<>(PropertyRef.of(name, getter), message));
    }

    public <V> ConfigValidationBuilder<T> notNull(String name, Function<? super T, ? extends V> getter) {
        return notNull(name, getter, null);
    }

    public <V> ConfigValidationBuilder<T> notNull(String name, Function<? super T, ? extends V> getter, String message) {
        return addRule(new NotNullRule<T, V>(PropertyRef.of(name, getter), message));
    }

    public ConfigValidationBuilder<T> matchesPattern(String name, Function<? super T, String> getter, String pattern) {
        return matchesPattern(name, getter, pattern, null);
    }

    public ConfigValidationBuilder<T> matchesPattern(String name, Function<? super T, String> getter, String pattern,
                                                     String message) {
        return addRule(new RegexRule<>(PropertyRef.of(name, getter), pattern, message));
    }

    // ------------------------------------------------------------------
    // Comparable rules
    // ------------------------------------------------------------------

    public <V extends Comparable<? super V>> ConfigValidationBuilder<T> greaterThan(
            String name, Function<? super T, ? extends V> getter, V minimum) {
        return greaterThan(name, getter, minimum, null);
    }

    public <V extends Comparable<? super V>> ConfigValidationBuilder<T> greaterThan(
            String name, Function<? super T, ? extends V> getter, V minimum, String message) {
        return addRule(new GreaterThanRule<T, V>(PropertyRef.of(name, getter), minimum, message));
    }

    public <V extends Comparable<? super V>> ConfigValidationBuilder<T> lessThan(
            String name, Function<? super T, ? extends V> getter, V maximum) {
        return lessThan(name, getter, maximum, null);
    }

    public <V extends Comparable<? super V>> ConfigValidationBuilder<T> lessThan(
            String name, Function<? super T, ? extends V> getter, V maximum, String message) {
        return addRule(new LessThanRule<T, V>(PropertyRef.of(name, getter), maximum, message));
    }

    public <V extends Comparable<? super V>> ConfigValidationBuilder<T> minimum(
            String name, Function<? super T, ? extends V> getter, V minimum) {
        return minimum(name, getter, minimum, null);
    }

    public <V extends Comparable<? super V>> ConfigValidationBuilder<T> minimum(
            String name, Function<? super T, ? extends V> getter, V minimum, String message) {
        return addRule(new MinimumRule<T, V>(PropertyRef.of(name, getter), minimum, message));
    }

    public <V extends Comparable<? super V>> ConfigValidationBuilder<T> maximum(
            String name, Function<? super T, ? extends V> getter, V maximum) {
        return maximum(name, getter, maximum, null);
    }

    public <V extends Comparable<? super V>> ConfigValidationBuilder<T> maximum(
            String name, Function<? super T, ? extends V> getter, V maximum, String message) {
        return addRule(new MaximumRule<T, V>(PropertyRef.of(name, getter), maximum, message));
    }

    public <V extends Comparable<? super V>> ConfigValidationBuilder<T> inRange(
            String name, Function<? super T, ? extends V> getter, V minimum, V maximum) {
        return inRange(name, getter, minimum, maximum, null);
    }

    public <V extends Comparable<? super V>> ConfigValidationBuilder<T> inRange(
            String name, Function<? super T, ? extends V> getter, V minimum, V maximum, String message) {
        return addRule(new RangeRule<T, V>(PropertyRef.of(name, getter), minimum, maximum, message));
    }

    // ------------------------------------------------------------------
    // Security rules
    // ------------------------------------------------------------------

    public ConfigValidationBuilder<T> noPlainTextSecrets(String name, Function<? super T, String> getter) {
        return noPlainTextSecrets(name, getter, null);
    }

    public ConfigValidationBuilder<T> noPlainTextSecrets(String name, Function<? super T, String> getter, String message) {
        return addRule(new NoPlainTextSecretsRule<>(PropertyRef.of(name, getter), message));
    }

    public ConfigValidationBuilder<T> validateSecretFormat(String name, Function<? super T, String> getter,
                                                           SecretFormat format) {
        return validateSecretFormat(name, getter, format, null);
    }

    public ConfigValidationBuilder<T> validateSecretFormat(String name, Function<? super T, String> getter,
                                                           SecretFormat format, String message) {
        return addRule(new SecretFormatRule<>(PropertyRef.of(name, getter), format, message));
    }

    public ConfigValidationBuilder<T> warnIfDefaultValue(String name, Function<? super T, String> getter,
                                                         String defaultValue) {
        return warnIfDefaultValue(name, getter, defaultValue, SecurityLevel.WARNING, null);
    }

    public ConfigValidationBuilder<T> warnIfDefaultValue(String name, Function<? super T, String> getter,
                                                         String defaultValue, SecurityLevel level) {
        return warnIfDefaultValue(name, getter, defaultValue, level, null);
    }

    public ConfigValidationBuilder<T> warnIfDefaultValue(String name, Function<? super T, String> getter,
                                                         String defaultValue, SecurityLevel level, String message) {
        return addRule(new DefaultValueWarningRule<>(PropertyRef.of(name, getter), defaultValue, level, message));
    }

    // ------------------------------------------------------------------
    // File system and network rules
    // ------------------------------------------------------------------

    public ConfigValidationBuilder<T> fileExists(String name, Function<? super T, String> getter) {
        return fileExists(name, getter, null);
    }

    public ConfigValidationBuilder<T> fileExists(String name, Function<? super T, String> getter, String message) {
        return addRule(new FileExistsRule<>(PropertyRef.of(name, getter), message));
    }

    public ConfigValidationBuilder<T> directoryExists(String name, Function<? super T, String> getter) {
        return directoryExists(name, getter, null);
    }

    public ConfigValidationBuilder<T> directoryExists(String name, Function<? super T, String> getter, String message) {
        return addRule(new DirectoryExistsRule<>(PropertyRef.of(name, getter), message));
    }

    public ConfigValidationBuilder<T> urlReachable(String name, Function<? super T, String> getter) {
        return urlReachable(name, getter, UrlReachableRule.DEFAULT_TIMEOUT, null);
    }

    public ConfigValidationBuilder<T> urlReachable(String name, Function<? super T, String> getter, Duration timeout) {
        return urlReachable(name, getter, timeout, null);
    }

    public ConfigValidationBuilder<T> urlReachable(String name, Function<? super T, String> getter, Duration timeout,
                                                   String message) {
        return addRule(new UrlReachableRule<>(PropertyRef.of(name, getter), timeout, message));
    }

    public ConfigValidationBuilder<T> portAvailable(String name, Function<? super T, Integer> getter) {
        return portAvailable(name, getter, null);
    }

    public ConfigValidationBuilder<T> portAvailable(String name, Function<? super T, Integer> getter, String message) {
        return addRule(new PortAvailableRule<>(PropertyRef.of(name, getter), message));
    }

    // ------------------------------------------------------------------
    // Conditional rules
    // ------------------------------------------------------------------

    /**
     * Apply the rules registered by {@code configure} only when {@code condition} holds.
     * <p>
     * Blocks nest; a nested rule runs only when every enclosing condition holds.
     *
     * @param condition predicate over the whole configuration object
     * @param configure callback registering the conditional rules on this builder
     * @return this builder
     */
    public ConfigValidationBuilder<T> when(Predicate<? super T> condition, Consumer<ConfigValidationBuilder<T>> configure) {
        Objects.requireNonNull(configure, "Configure callback must not be null");
        ConditionalScope<T> scope = beginConditionalScope(condition);
        try {
            configure.accept(this);
        } finally {
            endConditionalScope(scope);
        }
        return this;
    }

    /**
     * Open a conditional scope. Rules added until the matching
     * {@link #endConditionalScope(ConditionalScope)} are gated by {@code condition}.
     */
    public ConditionalScope<T> beginConditionalScope(Predicate<? super T> condition) {
        Objects.requireNonNull(condition, "Condition must not be null");
        ConditionalScope<T> scope = new ConditionalScope<>(condition, rules.size());
        openScopes.push(scope);
        return scope;
    }

    /**
     * Close the innermost conditional scope, wrapping the rules added inside it in place.
     *
     * @throws IllegalStateException if {@code scope} is not the innermost open scope
     */
    public ConfigValidationBuilder<T> endConditionalScope(ConditionalScope<T> scope) {
        Objects.requireNonNull(scope, "Scope must not be null");
        if (openScopes.peek() != scope) {
            throw new IllegalStateException("Conditional scopes must be closed innermost first");
        }
        openScopes.pop();

        int first = scope.firstRuleIndex();
        for (int i = first; i < rules.size(); i++) {
            rules.set(i, new ConditionalRule<>(scope.condition(), rules.get(i)));
        }
        logger.debug("Wrapped {} rule(s) in a condition for section '{}'", rules.size() - first, sectionName);
        return this;
    }

    // ------------------------------------------------------------------
    // Environment-specific rules
    // ------------------------------------------------------------------

    /**
     * Override the environment name used by {@link #whenEnvironment(String, Consumer)}.
     */
    public ConfigValidationBuilder<T> withEnvironment(String environmentName) {
        Objects.requireNonNull(environmentName, "Environment name must not be null");
        this.environment = () -> environmentName;
        return this;
    }

    public String currentEnvironment() {
        return environment.get();
    }

    /**
     * Register the rules from {@code configure} only if the application runs in the named
     * environment (case-insensitive). The environment is resolved now, not at validation time.
     */
    public ConfigValidationBuilder<T> whenEnvironment(String environmentName, Consumer<ConfigValidationBuilder<T>> configure) {
        Objects.requireNonNull(environmentName, "Environment name must not be null");
        Objects.requireNonNull(configure, "Configure callback must not be null");

        if (environmentName.equalsIgnoreCase(currentEnvironment())) {
            configure.accept(this);
        }
        return this;
    }

    public ConfigValidationBuilder<T> whenDevelopment(Consumer<ConfigValidationBuilder<T>> configure) {
        return whenEnvironment(Environments.DEVELOPMENT, configure);
    }

    public ConfigValidationBuilder<T> whenStaging(Consumer<ConfigValidationBuilder<T>> configure) {
        return whenEnvironment(Environments.STAGING, configure);
    }

    public ConfigValidationBuilder<T> whenProduction(Consumer<ConfigValidationBuilder<T>> configure) {
        return whenEnvironment(Environments.PRODUCTION, configure);
    }
}
