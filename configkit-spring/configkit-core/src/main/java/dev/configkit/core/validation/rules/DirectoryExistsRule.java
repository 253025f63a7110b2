package dev.configkit.core.validation.rules;

import dev.configkit.core.ConfigValidationError;
import dev.configkit.core.validation.PropertyRef;
import dev.configkit.core.validation.PropertyRule;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Fails when a path property is blank or does not point to a directory.
 */
public final class DirectoryExistsRule<T> extends PropertyRule<T, String> {

    public DirectoryExistsRule(PropertyRef<T, String> property, String customMessage) {
        super(property, customMessage);
    }

    @Override
    public Optional<ConfigValidationError> validate(T options, String sectionName) {
        String path = valueOf(options);

        if (isBlank(path)) {
            return Optional.of(new ConfigValidationError(
                    key(sectionName),
                    messageOr(propertyName() + " directory path is not specified"),
                    path,
                    List.of("Specify a valid directory path")));
        }

        if (!isDirectory(path)) {
            return Optional.of(new ConfigValidationError(
                    key(sectionName),
                    messageOr("Directory does not exist: " + path),
                    path,
                    List.of("Create directory at: " + path)));
        }

        return Optional.empty();
    }

    private static boolean isDirectory(String path) {
        try {
            return Files.isDirectory(Path.of(path));
        } catch (InvalidPathException e) {
            return false;
        }
    }
}
