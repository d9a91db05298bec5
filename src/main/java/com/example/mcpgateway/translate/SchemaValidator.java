package com.example.mcpgateway.translate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.networknt.schema.JsonNodePath;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaException;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SchemaValidatorsConfig;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Checks decoded JSON values against canonical schemas produced by
 * {@link SchemaTranslator}, using JSON Schema 2020-12 semantics. Reports the
 * first violation with a dotted field path such as {@code items[1].qty}.
 */
@Component
public class SchemaValidator {

    private static final Logger logger = LoggerFactory.getLogger(SchemaValidator.class);

    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final int CACHE_LIMIT = 4096;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SchemaValidatorsConfig config = new SchemaValidatorsConfig();
    // equal canonical schemas share one compiled schema
    private final Map<Map<String, Object>, JsonSchema> compiled = new ConcurrentHashMap<>();

    public SchemaValidator() {
        config.setFormatAssertionsEnabled(true);
    }

    public record Violation(String field, String message) {
        @Override
        public String toString() {
            return (field == null || field.isEmpty() ? "<root>" : field) + " " + message;
        }
    }

    public Optional<Violation> validate(Map<String, Object> schema, Object value) {
        if (schema == null || Boolean.TRUE.equals(schema.get(SchemaTranslator.OPAQUE))) {
            return Optional.empty();
        }
        JsonNode instance = value == null ? NullNode.getInstance() : objectMapper.valueToTree(value);
        Set<ValidationMessage> messages;
        try {
            messages = compile(schema).validate(instance);
        } catch (JsonSchemaException e) {
            logger.warn("Schema could not be evaluated, value left unchecked: {}", e.getMessage());
            return Optional.empty();
        }
        return messages.stream().findFirst().map(SchemaValidator::toViolation);
    }

    private JsonSchema compile(Map<String, Object> schema) {
        if (compiled.size() >= CACHE_LIMIT) {
            compiled.clear();
        }
        return compiled.computeIfAbsent(schema, s -> {
            JsonNode node = objectMapper.valueToTree(toJsonSchema(s));
            try {
                return SCHEMA_FACTORY.getSchema(node, config);
            } catch (JsonSchemaException e) {
                logger.warn("Backend schema is not valid JSON Schema, accepting any value: {}", e.getMessage());
                return SCHEMA_FACTORY.getSchema(objectMapper.createObjectNode(), config);
            }
        });
    }

    /**
     * Canonical form to JSON Schema: opaque nodes accept anything, {@code nullable}
     * widens the type, and boolean exclusive bounds become numeric ones.
     */
    @SuppressWarnings("unchecked")
    Map<String, Object> toJsonSchema(Map<String, Object> canonical) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (canonical == null || Boolean.TRUE.equals(canonical.get(SchemaTranslator.OPAQUE))) {
            return out;
        }
        canonical.forEach((key, value) -> {
            switch (key) {
                case "nullable", "description", SchemaTranslator.OPAQUE, SchemaTranslator.BACKEND_SCHEMA -> {
                }
                case "properties" -> {
                    Map<String, Object> properties = new LinkedHashMap<>();
                    if (value instanceof Map<?, ?> props) {
                        props.forEach((name, property) -> properties.put(String.valueOf(name),
                                property instanceof Map<?, ?> p ? toJsonSchema((Map<String, Object>) p) : Map.of()));
                    }
                    out.put("properties", properties);
                }
                case "items" -> out.put("items",
                        value instanceof Map<?, ?> items ? toJsonSchema((Map<String, Object>) items) : Map.of());
                default -> out.put(key, value);
            }
        });
        if (Boolean.TRUE.equals(canonical.get("nullable")) && out.get("type") instanceof String type
                && !"null".equals(type)) {
            out.put("type", List.of(type, "null"));
        }
        legacyExclusiveBound(out, "exclusiveMinimum", "minimum");
        legacyExclusiveBound(out, "exclusiveMaximum", "maximum");
        return out;
    }

    private static void legacyExclusiveBound(Map<String, Object> schema, String exclusive, String inclusive) {
        if (!(schema.get(exclusive) instanceof Boolean flag)) return;
        schema.remove(exclusive);
        if (flag && schema.get(inclusive) != null) {
            schema.put(exclusive, schema.remove(inclusive));
        }
    }

    private static Violation toViolation(ValidationMessage message) {
        String field = fieldOf(message.getInstanceLocation());
        if ("required".equals(message.getType())) {
            String missing = message.getProperty();
            if (missing == null && message.getArguments() != null && message.getArguments().length > 0) {
                missing = String.valueOf(message.getArguments()[0]);
            }
            if (missing != null) {
                return new Violation(child(field, missing), "is required");
            }
        }
        return new Violation(field, withoutLocation(message.getMessage()));
    }

    private static String fieldOf(JsonNodePath location) {
        StringBuilder sb = new StringBuilder();
        if (location == null) return "";
        for (int i = 0; i < location.getNameCount(); i++) {
            Object element = location.getElement(i);
            if (element instanceof Integer index) {
                sb.append('[').append(index).append(']');
            } else {
                if (sb.length() > 0) sb.append('.');
                sb.append(element);
            }
        }
        return sb.toString();
    }

    // messages are prefixed with the instance location, e.g. "$.text: integer found, string expected"
    private static String withoutLocation(String message) {
        if (message == null) return "is invalid";
        int colon = message.indexOf(": ");
        if ((message.startsWith("$") || message.startsWith("/")) && colon > 0) {
            return message.substring(colon + 2);
        }
        return message;
    }

    /**
     * Builds a payload from query parameters, converting each value to the
     * declared property type where it parses. Unparseable values are left as
     * strings so validation reports them.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> fromQuery(Map<String, Object> schema, MultiValueMap<String, String> query) {
        Map<String, Object> properties = schema != null && schema.get("properties") instanceof Map<?, ?> p
                ? (Map<String, Object>) p : Map.of();
        Map<String, Object> payload = new LinkedHashMap<>();
        query.forEach((name, values) -> {
            Map<String, Object> propertySchema = properties.get(name) instanceof Map<?, ?> s
                    ? (Map<String, Object>) s : Map.of();
            String type = (String) propertySchema.get("type");
            if ("array".equals(type)) {
                Map<String, Object> items = propertySchema.get("items") instanceof Map<?, ?> i
                        ? (Map<String, Object>) i : Map.of();
                List<Object> converted = new ArrayList<>();
                for (String v : values) converted.add(coerce((String) items.get("type"), v));
                payload.put(name, converted);
            } else if (!values.isEmpty()) {
                payload.put(name, coerce(type, values.get(0)));
            }
        });
        return payload;
    }

    private Object coerce(String type, String raw) {
        if (raw == null || type == null) return raw;
        try {
            switch (type) {
                case "integer":
                    return new BigInteger(raw.trim()).longValueExact();
                case "number":
                    return new BigDecimal(raw.trim()).doubleValue();
                case "boolean":
                    if ("true".equalsIgnoreCase(raw)) return Boolean.TRUE;
                    if ("false".equalsIgnoreCase(raw)) return Boolean.FALSE;
                    return raw;
                default:
                    return raw;
            }
        } catch (NumberFormatException | ArithmeticException e) {
            return raw;
        }
    }

    private static String child(String path, String name) {
        return path.isEmpty() ? name : path + "." + name;
    }
}
