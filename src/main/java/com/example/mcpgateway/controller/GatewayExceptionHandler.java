package com.example.mcpgateway.controller;

import com.example.mcpgateway.error.GatewayErrorKind;
import com.example.mcpgateway.error.GatewayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import java.util.HashMap;
import java.util.Map;

/**
 * Renders every failure as {@code {"error": {...}, "isError": true}}.
 */
@RestControllerAdvice
public class GatewayExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GatewayExceptionHandler.class);

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<Map<String, Object>> handleGateway(GatewayException e, ServerWebExchange exchange) {
        if (e.getKind() == GatewayErrorKind.BACKEND_UNAVAILABLE || e.getKind() == GatewayErrorKind.INVOCATION_TIMEOUT) {
            logger.warn("{}", e.getMessage());
        } else {
            logger.debug("{}", e.getMessage());
        }
        return createErrorResponse(e, exchange);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleInput(ServerWebInputException e, ServerWebExchange exchange) {
        GatewayException error = GatewayException.validation(null, null, null,
                "Unreadable request: " + e.getReason());
        return createErrorResponse(error, exchange);
    }

    private ResponseEntity<Map<String, Object>> createErrorResponse(GatewayException e, ServerWebExchange exchange) {
        String correlationId = GatewayController.correlationId(exchange);
        Map<String, Object> error = e.toMap();
        error.put("correlationId", correlationId);
        Map<String, Object> body = new HashMap<>();
        body.put("error", error);
        body.put("isError", true);
        return ResponseEntity.status(e.getKind().getStatus())
                .header(GatewayController.CORRELATION_HEADER, correlationId)
                .body(body);
    }
}
