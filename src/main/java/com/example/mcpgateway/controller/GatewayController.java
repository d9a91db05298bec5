package com.example.mcpgateway.controller;

import com.example.mcpgateway.service.Dispatcher;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

/**
 * Serves every registered operation at {@code /{backendId}/{operation}}.
 * Which routes exist is decided by the registry, not by this mapping.
 */
@RestController
public class GatewayController {

    public static final String CORRELATION_HEADER = "X-Correlation-Id";
    public static final String TIMEOUT_HEADER = "X-Gateway-Timeout-Ms";
    public static final String CORRELATION_ATTRIBUTE = GatewayController.class.getName() + ".correlationId";

    private final Dispatcher dispatcher;

    public GatewayController(Dispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @RequestMapping(value = "/{backendId}/{operation}",
            method = {RequestMethod.GET, RequestMethod.POST},
            produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Map<String, Object>>> invoke(ServerWebExchange exchange,
                                                           @RequestBody(required = false) Map<String, Object> body,
                                                           @RequestHeader(value = TIMEOUT_HEADER, required = false) Long timeoutMs) {
        ServerHttpRequest request = exchange.getRequest();
        String correlationId = correlationId(exchange);
        Duration hint = timeoutMs == null ? null : Duration.ofMillis(timeoutMs);

        return dispatcher.dispatch(request.getMethod().name(),
                        request.getPath().pathWithinApplication().value(),
                        body, request.getQueryParams(), hint, correlationId)
                .map(result -> ResponseEntity.ok()
                        .header(CORRELATION_HEADER, correlationId)
                        .body(result));
    }

    static String correlationId(ServerWebExchange exchange) {
        String existing = exchange.getAttribute(CORRELATION_ATTRIBUTE);
        if (existing != null) return existing;
        String header = exchange.getRequest().getHeaders().getFirst(CORRELATION_HEADER);
        String id = header == null || header.isBlank() ? UUID.randomUUID().toString() : header;
        exchange.getAttributes().put(CORRELATION_ATTRIBUTE, id);
        return id;
    }
}
