package dev.configkit.spring.test;

import dev.configkit.core.ConfigValidationError;
import org.assertj.core.api.AbstractAssert;

import java.util.List;
import java.util.stream.Collectors;

/**
 * AssertJ assertions over the errors a validation builder reports for one configuration object.
 *
 * @see ConfigKitAssertions#assertThat(dev.configkit.core.validation.ConfigValidationBuilder, Object)
 */
public class ConfigValidationAssert extends AbstractAssert<ConfigValidationAssert, List<ConfigValidationError>> {

    public ConfigValidationAssert(List<ConfigValidationError> errors) {
        super(errors, ConfigValidationAssert.class);
    }

    public ConfigValidationAssert isValid() {
        isNotNull();
        if (!actual.isEmpty()) {
            failWithMessage("Expected configuration to be valid but found %d error(s):%n%s", actual.size(), render());
        }
        return this;
    }

    public ConfigValidationAssert isInvalid() {
        isNotNull();
        if (actual.isEmpty()) {
            failWithMessage("Expected configuration to be invalid but no error was reported");
        }
        return this;
    }

    public ConfigValidationAssert hasErrorCount(int expected) {
        isNotNull();
        if (actual.size() != expected) {
            failWithMessage("Expected %d error(s) but found %d:%n%s", expected, actual.size(), render());
        }
        return this;
    }

    /**
     * Verify that an error is reported for the given key, e.g. {@code Database:connectionString}.
     */
    public ConfigValidationAssert hasErrorFor(String key) {
        isNotNull();
        if (actual.stream().noneMatch(error -> error.key().equals(key))) {
            failWithMessage("Expected an error for <%s> but found errors for %s", key, keys());
        }
        return this;
    }

    public ConfigValidationAssert hasNoErrorFor(String key) {
        isNotNull();
        if (actual.stream().anyMatch(error -> error.key().equals(key))) {
            failWithMessage("Expected no error for <%s> but found:%n%s", key, render());
        }
        return this;
    }

    public ConfigValidationAssert hasErrorWithMessageContaining(String text) {
        isNotNull();
        if (actual.stream().noneMatch(error -> error.message().contains(text))) {
            failWithMessage("Expected an error message containing <%s> but found:%n%s", text, render());
        }
        return this;
    }

    private List<String> keys() {
        return actual.stream().map(ConfigValidationError::key).toList();
    }

    private String render() {
        return actual.stream().map(ConfigValidationError::toString).collect(Collectors.joining());
    }
}
