package dev.configkit.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import dev.configkit.core.exception.ConfigKitException;
import dev.configkit.core.validation.ConfigValidationBuilder;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of validating one configuration object, for logs and diagnostics endpoints.
 *
 * @param sectionName       the configuration section
 * @param configurationType the validated type
 * @param errors            the errors in rule order, empty when valid
 */
public record ValidationReport(String sectionName, Class<?> configurationType, List<ConfigValidationError> errors) {

    public ValidationReport {
        Objects.requireNonNull(sectionName, "Section name must not be null");
        Objects.requireNonNull(configurationType, "Configuration type must not be null");
        errors = List.copyOf(errors);
    }

    public static <T> ValidationReport of(ConfigValidationBuilder<T> builder, T options) {
        return new ValidationReport(builder.getSectionName(), builder.getType(), builder.errors(options));
    }

    public boolean valid() {
        return errors.isEmpty();
    }

    /**
     * All rendered errors, one block per error.
     */
    public String toText() {
        StringBuilder sb = new StringBuilder();
        errors.forEach(sb::append);
        return sb.toString();
    }

    public ObjectNode toJsonNode(ObjectMapper mapper) {
        ObjectNode root = mapper.createObjectNode();
        root.put("section", sectionName);
        root.put("type", configurationType.getName());
        root.put("valid", valid());

        ArrayNode items = root.putArray("errors");
        for (ConfigValidationError error : errors) {
            ObjectNode item = items.addObject();
            item.put("key", error.key());
            item.put("message", error.message());
            if (error.currentValue() != null) {
                item.set("currentValue", currentValueNode(mapper, error.currentValue()));
            }
            ArrayNode suggestions = item.putArray("suggestions");
            error.suggestions().forEach(suggestions::add);
        }
        return root;
    }

    // Scalars keep their JSON type; anything else uses the same text as the rendered error
    private static JsonNode currentValueNode(ObjectMapper mapper, Object value) {
        if (value instanceof Number || value instanceof Boolean) {
            return mapper.valueToTree(value);
        }
        return TextNode.valueOf(String.valueOf(value));
    }

    public String toJson(ObjectMapper mapper) {
        try {
            return mapper.writeValueAsString(toJsonNode(mapper));
        } catch (JsonProcessingException e) {
            throw new ConfigKitException("Failed to serialize validation report for section '" + sectionName + "'", e);
        }
    }
}
