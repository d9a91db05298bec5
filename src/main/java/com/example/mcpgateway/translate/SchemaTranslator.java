package com.example.mcpgateway.translate;

import com.example.mcpgateway.model.OperationDescriptor;
import com.example.mcpgateway.model.RouteDescriptor;
import com.example.mcpgateway.model.RouteMethod;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Maps a backend operation descriptor onto a canonical route descriptor.
 *
 * <p>Pure and deterministic: equal descriptors always produce equal routes,
 * with schema keys emitted in a fixed order. Operation names are never
 * rewritten; two backends exposing the same name are told apart by the
 * {@code /{backendId}/{operation}} path alone.
 *
 * <p>Schema constructs with no canonical equivalent (missing type,
 * {@code anyOf}/{@code oneOf}/{@code allOf}, {@code $ref}, unknown types) become
 * opaque values carrying the original fragment verbatim.
 */
@Component
public class SchemaTranslator {

    public static final String OPAQUE = "x-opaque";
    public static final String BACKEND_SCHEMA = "x-backend-schema";

    private static final Set<String> PRIMITIVES = Set.of("string", "number", "integer", "boolean", "null");
    private static final List<String> CONSTRAINTS = List.of(
            "format", "default", "minimum", "maximum", "exclusiveMinimum", "exclusiveMaximum",
            "multipleOf", "minLength", "maxLength", "pattern", "minItems", "maxItems", "uniqueItems");

    public static final Map<String, Object> ERROR_SCHEMA = errorSchema();

    // sorted keys keep x-backend-schema stable regardless of the backend's map order
    private final ObjectMapper canonicalWriter = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    public List<RouteDescriptor> translateAll(String backendId, List<OperationDescriptor> operations) {
        List<RouteDescriptor> routes = new ArrayList<>(operations.size());
        for (OperationDescriptor op : operations) {
            routes.add(translate(backendId, op));
        }
        return routes;
    }

    public RouteDescriptor translate(String backendId, OperationDescriptor op) {
        Map<String, Object> request = requestSchema(op.getInputSchema());
        Map<String, Object> response = op.getOutputSchema() == null
                ? opaque(null, "Unstructured result returned by the backend")
                : canonical(op.getOutputSchema());

        return RouteDescriptor.builder()
                .backendId(backendId)
                .operationName(op.getName())
                .path(pathFor(backendId, op.getName()))
                .method(methodFor(op, request))
                .summary(summaryOf(op))
                .description(op.getDescription() == null ? "" : op.getDescription())
                .requestSchema(request)
                .responseSchema(response)
                .errorSchema(ERROR_SCHEMA)
                .build();
    }

    public static String pathFor(String backendId, String operationName) {
        return "/" + UriUtils.encodePathSegment(backendId, StandardCharsets.UTF_8)
                + "/" + UriUtils.encodePathSegment(operationName, StandardCharsets.UTF_8);
    }

    /** Mutating or unclassified operations are POST; read-only ones without required fields are GET. */
    RouteMethod methodFor(OperationDescriptor op, Map<String, Object> request) {
        if (!Boolean.TRUE.equals(op.getReadOnly())) {
            return RouteMethod.POST;
        }
        return requiredFields(request).isEmpty() ? RouteMethod.GET : RouteMethod.POST;
    }

    private Map<String, Object> requestSchema(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            Map<String, Object> empty = new LinkedHashMap<>();
            empty.put("type", "object");
            empty.put("properties", new LinkedHashMap<>());
            return Collections.unmodifiableMap(empty);
        }
        return canonical(input);
    }

    Map<String, Object> canonical(Object node) {
        if (!(node instanceof Map<?, ?> raw)) {
            return opaque(node, null);
        }
        Map<String, Object> schema = asMap(raw);
        String description = schema.get("description") instanceof String d ? d : null;
        if (schema.containsKey("$ref") || schema.containsKey("anyOf")
                || schema.containsKey("oneOf") || schema.containsKey("allOf")) {
            return opaque(schema, description);
        }

        Object typeValue = schema.get("type");
        boolean nullable = Boolean.TRUE.equals(schema.get("nullable"));
        String type = null;
        if (typeValue instanceof String t) {
            type = t;
        } else if (typeValue instanceof List<?> types) {
            List<String> nonNull = new ArrayList<>();
            for (Object t : types) {
                if ("null".equals(t)) nullable = true;
                else if (t instanceof String s) nonNull.add(s);
            }
            if (nonNull.size() == 1) type = nonNull.get(0);
        } else if (typeValue == null && schema.get("properties") instanceof Map<?, ?>) {
            type = "object";
        }

        if (type == null || !(PRIMITIVES.contains(type) || "array".equals(type) || "object".equals(type))) {
            return opaque(schema, description);
        }

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("type", type);
        if (nullable) out.put("nullable", true);
        if (description != null) out.put("description", description);
        if (schema.get("enum") instanceof List<?> values) {
            out.put("enum", Collections.unmodifiableList(new ArrayList<>(values)));
        }
        for (String key : CONSTRAINTS) {
            if (schema.containsKey(key) && schema.get(key) != null) out.put(key, schema.get(key));
        }

        if ("array".equals(type)) {
            Object items = schema.get("items");
            out.put("items", items == null ? opaque(null, "Items of any shape") : canonical(items));
        } else if ("object".equals(type)) {
            Map<String, Object> properties = new LinkedHashMap<>();
            if (schema.get("properties") instanceof Map<?, ?> props) {
                for (Map.Entry<?, ?> e : props.entrySet()) {
                    properties.put(String.valueOf(e.getKey()), canonical(e.getValue()));
                }
            }
            out.put("properties", Collections.unmodifiableMap(properties));
            List<String> required = new ArrayList<>();
            if (schema.get("required") instanceof List<?> req) {
                for (Object r : req) {
                    if (r instanceof String s && !required.contains(s)) required.add(s);
                }
            }
            if (!required.isEmpty()) out.put("required", List.copyOf(required));
            if (schema.get("additionalProperties") instanceof Boolean additional) {
                out.put("additionalProperties", additional);
            }
        }
        return Collections.unmodifiableMap(out);
    }

    private Map<String, Object> opaque(Object original, String description) {
        Map<String, Object> out = new LinkedHashMap<>();
        String verbatim = original == null ? null : serialize(original);
        String text = description;
        if (verbatim != null) {
            text = (description == null ? "Free-form value" : description) + " (backend schema: " + verbatim + ")";
        }
        if (text != null) out.put("description", text);
        out.put(OPAQUE, true);
        if (verbatim != null) out.put(BACKEND_SCHEMA, verbatim);
        return Collections.unmodifiableMap(out);
    }

    private String serialize(Object value) {
        try {
            return canonicalWriter.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    private static String summaryOf(OperationDescriptor op) {
        String description = op.getDescription();
        if (description == null || description.isBlank()) return op.getName();
        String firstLine = description.strip().lines().findFirst().orElse(op.getName());
        return firstLine.length() > 120 ? firstLine.substring(0, 117) + "..." : firstLine;
    }

    @SuppressWarnings("unchecked")
    public static List<String> requiredFields(Map<String, Object> schema) {
        Object required = schema == null ? null : schema.get("required");
        return required instanceof List<?> list ? (List<String>) list : List.of();
    }

    private static Map<String, Object> errorSchema() {
        Map<String, Object> string = Map.of("type", "string");
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("type", "object");
        Map<String, Object> errorProps = new LinkedHashMap<>();
        errorProps.put("kind", Map.of("type", "string", "enum", List.of(
                "BackendUnreachable", "BackendUnavailable", "BackendOverloaded", "UnknownRoute",
                "ValidationError", "SchemaViolation", "InvocationTimeout", "BusinessError")));
        errorProps.put("status", Map.of("type", "integer"));
        errorProps.put("message", string);
        errorProps.put("backend", string);
        errorProps.put("operation", string);
        errorProps.put("field", string);
        errorProps.put("businessError", string);
        errorProps.put("correlationId", string);
        error.put("properties", Collections.unmodifiableMap(errorProps));
        error.put("required", List.of("kind", "message"));

        Map<String, Object> root = new LinkedHashMap<>();
        root.put("type", "object");
        Map<String, Object> rootProps = new LinkedHashMap<>();
        rootProps.put("error", Collections.unmodifiableMap(error));
        rootProps.put("isError", Map.of("type", "boolean"));
        root.put("properties", Collections.unmodifiableMap(rootProps));
        root.put("required", List.of("error", "isError"));
        return Collections.unmodifiableMap(root);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }
}
