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
 * Fails when a path property is blank or does not point to a regular file.
 */
public final class FileExistsRule<T> extends PropertyRule<T, String> {

    public FileExistsRule(PropertyRef<T, String> property, String customMessage) {
        super(property, customMessage);
    }

    @Override
    public Optional<ConfigValidationError> validate(T options, String sectionName) {
        String path = valueOf(options);

        if (isBlank(path)) {
            return Optional.of(new ConfigValidationError(
                    key(sectionName),
                    messageOr(propertyName() + " file path is not specified"),
                    path,
                    List.of("Specify a valid file path")));
        }

        if (!isRegularFile(path)) {
            return Optional.of(new ConfigValidationError(
                    key(sectionName),
                    messageOr("File does not exist: " + path),
                    path,
                    List.of("Create file at: " + path)));
        }

        return Optional.empty();
    }

    private static boolean isRegularFile(String path) {
        try {
            return Files.isRegularFile(Path.of(path));
        } catch (InvalidPathException e) {
            return false;
        }
    }
}
