package com.example.mcpgateway.service;

import com.example.mcpgateway.config.GatewayProperties;
import com.example.mcpgateway.error.GatewayException;
import com.example.mcpgateway.model.InvocationContext;
import com.example.mcpgateway.model.RouteDescriptor;
import com.example.mcpgateway.model.RouteMethod;
import com.example.mcpgateway.registry.RouteEntry;
import com.example.mcpgateway.registry.RouteRegistry;
import com.example.mcpgateway.translate.SchemaValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

@Service
public class Dispatcher {

    private static final Logger logger = LoggerFactory.getLogger(Dispatcher.class);

    private final RouteRegistry registry;
    private final SchemaValidator validator;
    private final GatewayProperties properties;

    public Dispatcher(RouteRegistry registry, SchemaValidator validator, GatewayProperties properties) {
        this.registry = registry;
        this.validator = validator;
        this.properties = properties;
    }

    /**
     * Routes one inbound call. GET payloads come from {@code query}, POST
     * payloads from {@code body}. Cancelling the returned Mono cancels the
     * backend invocation.
     */
    public Mono<Map<String, Object>> dispatch(String method, String path, Map<String, Object> body,
                                              MultiValueMap<String, String> query, Duration timeoutHint,
                                              String correlationId) {
        return Mono.defer(() -> {
            RouteMethod routeMethod = RouteMethod.from(method);
            RouteEntry entry = registry.lookup(routeMethod, path)
                    .orElseThrow(() -> GatewayException.unknownRoute(method, path));
            RouteDescriptor route = entry.getRoute();

            Map<String, Object> payload = routeMethod == RouteMethod.GET
                    ? validator.fromQuery(route.getRequestSchema(), query == null ? new LinkedMultiValueMap<>() : query)
                    : (body == null ? Map.of() : body);
            validator.validate(route.getRequestSchema(), payload).ifPresent(v -> {
                throw GatewayException.validation(route.getBackendId(), route.getOperationName(),
                        v.field(), v.toString());
            });

            Duration timeout = effectiveTimeout(timeoutHint);
            InvocationContext ctx = new InvocationContext(correlationId, route.getBackendId(),
                    route.getOperationName(), payload, Instant.now().plus(timeout));
            logger.debug("Dispatching {} {} to backend {} [{}] timeout={}ms",
                    method, path, route.getBackendId(), correlationId, timeout.toMillis());

            return entry.getSession().invoke(ctx)
                    .map(result -> checkResponse(route, result, ctx))
                    .doOnCancel(ctx::cancel);
        });
    }

    private Map<String, Object> checkResponse(RouteDescriptor route, Map<String, Object> result,
                                              InvocationContext ctx) {
        validator.validate(route.getResponseSchema(), result).ifPresent(v -> {
            logger.error("Backend {} returned a response for {} that violates its declared schema: {} [{}]",
                    route.getBackendId(), route.getOperationName(), v, ctx.getCorrelationId());
            throw GatewayException.schemaViolation(route.getBackendId(), route.getOperationName(),
                    v.field(), v.toString());
        });
        return result;
    }

    Duration effectiveTimeout(Duration hint) {
        Duration configured = properties.getDefaultTimeout();
        if (hint == null || hint.isNegative() || hint.isZero()) {
            return configured;
        }
        return hint.compareTo(configured) < 0 ? hint : configured;
    }
}
