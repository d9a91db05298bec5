package com.example.mcpgateway.service;

import com.example.mcpgateway.config.GatewayProperties;
import com.example.mcpgateway.model.RouteDescriptor;
import com.example.mcpgateway.model.RouteMethod;
import com.example.mcpgateway.registry.RouteEntry;
import com.example.mcpgateway.registry.RouteRegistry;
import com.example.mcpgateway.translate.SchemaTranslator;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.swagger.v3.core.util.Json;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.Paths;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.parameters.Parameter;
import io.swagger.v3.oas.models.parameters.RequestBody;
import io.swagger.v3.oas.models.responses.ApiResponse;
import io.swagger.v3.oas.models.responses.ApiResponses;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders the registry's current snapshot as an OpenAPI document. Nothing is
 * cached: every call reflects the registry at that instant.
 */
@Service
public class CapabilityPublisher {

    static final String ERROR_SCHEMA_NAME = "GatewayError";
    private static final String JSON = org.springframework.http.MediaType.APPLICATION_JSON_VALUE;

    private static final Map<String, String> ERROR_RESPONSES = errorResponses();

    private final RouteRegistry registry;
    private final GatewayProperties properties;

    public CapabilityPublisher(RouteRegistry registry, GatewayProperties properties) {
        this.registry = registry;
        this.properties = properties;
    }

    public OpenAPI render() {
        RouteRegistry.Snapshot snapshot = registry.snapshot();
        OpenAPI api = new OpenAPI()
                .info(new Info()
                        .title(properties.getTitle())
                        .version(properties.getVersion())
                        .description("Operations of " + snapshot.backendIds().size()
                                + " backend(s), namespaced as /{backendId}/{operation}"));

        Paths paths = new Paths();
        for (RouteEntry entry : snapshot.routes()) {
            RouteDescriptor route = entry.getRoute();
            PathItem item = new PathItem();
            if (route.getMethod() == RouteMethod.GET) {
                item.get(operationFor(route));
            } else {
                item.post(operationFor(route));
            }
            paths.addPathItem(route.getPath(), item);
        }
        api.paths(paths);
        api.components(new Components().addSchemas(ERROR_SCHEMA_NAME, toSchema(SchemaTranslator.ERROR_SCHEMA)));
        return api;
    }

    public String renderJson() {
        try {
            return Json.mapper().writeValueAsString(render());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize API description", e);
        }
    }

    private Operation operationFor(RouteDescriptor route) {
        Operation operation = new Operation()
                .operationId(route.getBackendId() + "__" + route.getOperationName())
                .summary(route.getSummary())
                .description(route.getDescription())
                .addTagsItem(route.getBackendId());

        Map<String, Object> request = route.getRequestSchema();
        if (route.getMethod() == RouteMethod.GET) {
            List<String> required = SchemaTranslator.requiredFields(request);
            properties(request).forEach((name, schema) -> operation.addParametersItem(new Parameter()
                    .in("query")
                    .name(name)
                    .required(required.contains(name))
                    .schema(toSchema(schema))));
        } else {
            operation.requestBody(new RequestBody()
                    .required(true)
                    .content(json(toSchema(request))));
        }

        ApiResponses responses = new ApiResponses()
                .addApiResponse("200", new ApiResponse()
                        .description("Result of " + route.getOperationName())
                        .content(json(toSchema(route.getResponseSchema()))));
        ERROR_RESPONSES.forEach((status, description) -> responses.addApiResponse(status, new ApiResponse()
                .description(description)
                .content(json(new Schema<>().$ref("#/components/schemas/" + ERROR_SCHEMA_NAME)))));
        return operation.responses(responses);
    }

    private static Content json(Schema<?> schema) {
        return new Content().addMediaType(JSON, new MediaType().schema(schema));
    }

    @SuppressWarnings("unchecked")
    Schema<Object> toSchema(Map<String, Object> canonical) {
        Schema<Object> schema = new Schema<>();
        if (canonical == null) {
            return schema;
        }
        if (canonical.get("description") instanceof String description) {
            schema.description(description);
        }
        if (Boolean.TRUE.equals(canonical.get(SchemaTranslator.OPAQUE))) {
            schema.addExtension(SchemaTranslator.OPAQUE, true);
            if (canonical.get(SchemaTranslator.BACKEND_SCHEMA) != null) {
                schema.addExtension(SchemaTranslator.BACKEND_SCHEMA, canonical.get(SchemaTranslator.BACKEND_SCHEMA));
            }
            return schema;
        }

        String type = (String) canonical.get("type");
        if ("null".equals(type)) {
            schema.nullable(true);
        } else if (type != null) {
            schema.type(type);
        }
        if (Boolean.TRUE.equals(canonical.get("nullable"))) schema.nullable(true);
        if (canonical.get("enum") instanceof List<?> values) schema.setEnum(new ArrayList<>(values));
        if (canonical.get("format") instanceof String format) schema.format(format);
        if (canonical.containsKey("default")) schema.setDefault(canonical.get("default"));
        if (canonical.get("minimum") instanceof Number n) schema.minimum(new BigDecimal(n.toString()));
        if (canonical.get("maximum") instanceof Number n) schema.maximum(new BigDecimal(n.toString()));
        if (canonical.get("exclusiveMinimum") instanceof Number n) {
            schema.minimum(new BigDecimal(n.toString())).exclusiveMinimum(true);
        } else if (Boolean.TRUE.equals(canonical.get("exclusiveMinimum"))) {
            schema.exclusiveMinimum(true);
        }
        if (canonical.get("exclusiveMaximum") instanceof Number n) {
            schema.maximum(new BigDecimal(n.toString())).exclusiveMaximum(true);
        } else if (Boolean.TRUE.equals(canonical.get("exclusiveMaximum"))) {
            schema.exclusiveMaximum(true);
        }
        if (canonical.get("multipleOf") instanceof Number n) schema.multipleOf(new BigDecimal(n.toString()));
        if (canonical.get("minLength") instanceof Number n) schema.minLength(n.intValue());
        if (canonical.get("maxLength") instanceof Number n) schema.maxLength(n.intValue());
        if (canonical.get("pattern") instanceof String pattern) schema.pattern(pattern);
        if (canonical.get("minItems") instanceof Number n) schema.minItems(n.intValue());
        if (canonical.get("maxItems") instanceof Number n) schema.maxItems(n.intValue());
        if (canonical.get("uniqueItems") instanceof Boolean unique) schema.uniqueItems(unique);

        if ("array".equals(type) && canonical.get("items") instanceof Map<?, ?> items) {
            schema.items(toSchema((Map<String, Object>) items));
        }
        if ("object".equals(type)) {
            properties(canonical).forEach((name, property) -> schema.addProperty(name, toSchema(property)));
            List<String> required = SchemaTranslator.requiredFields(canonical);
            if (!required.isEmpty()) schema.required(new ArrayList<>(required));
            if (canonical.get("additionalProperties") instanceof Boolean additional) {
                schema.additionalProperties(additional);
            }
        }
        return schema;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Map<String, Object>> properties(Map<String, Object> schema) {
        Map<String, Map<String, Object>> out = new LinkedHashMap<>();
        if (schema != null && schema.get("properties") instanceof Map<?, ?> props) {
            props.forEach((k, v) -> {
                if (v instanceof Map<?, ?> m) out.put(String.valueOf(k), (Map<String, Object>) m);
            });
        }
        return out;
    }

    private static Map<String, String> errorResponses() {
        Map<String, String> responses = new LinkedHashMap<>();
        responses.put("400", "ValidationError: the payload does not match the request schema");
        responses.put("404", "UnknownRoute: no such operation is registered");
        responses.put("422", "BusinessError: the backend reported a domain failure");
        responses.put("429", "BackendOverloaded: the backend's concurrency limit is exhausted");
        responses.put("502", "SchemaViolation: the backend response does not match its declared schema");
        responses.put("503", "BackendUnavailable or BackendUnreachable: transport failure");
        responses.put("504", "InvocationTimeout: the deadline was exceeded");
        return Collections.unmodifiableMap(responses);
    }
}
