package com.example.mcpgateway.error;

import java.util.HashMap;
import java.util.Map;

/**
 * Typed failure surfaced to callers. The message always names the backend and
 * operation involved when they are known.
 */
public class GatewayException extends RuntimeException {

    private final GatewayErrorKind kind;
    private final String backendId;
    private final String operation;
    private final String field;
    private final String businessError;

    public GatewayException(GatewayErrorKind kind, String backendId, String operation, String detail) {
        this(kind, backendId, operation, null, detail, null);
    }

    public GatewayException(GatewayErrorKind kind, String backendId, String operation, String field,
                            String detail, Throwable cause) {
        this(kind, backendId, operation, field, null, detail, cause);
    }

    private GatewayException(GatewayErrorKind kind, String backendId, String operation, String field,
                             String businessError, String detail, Throwable cause) {
        super(describe(kind, backendId, operation, detail), cause);
        this.businessError = businessError;
        this.kind = kind;
        this.backendId = backendId;
        this.operation = operation;
        this.field = field;
    }

    public static GatewayException unknownRoute(String method, String path) {
        return new GatewayException(GatewayErrorKind.UNKNOWN_ROUTE, null, null,
                "No route registered for " + method + " " + path);
    }

    public static GatewayException validation(String backendId, String operation, String field, String detail) {
        return new GatewayException(GatewayErrorKind.VALIDATION_ERROR, backendId, operation, field, detail, null);
    }

    /** Domain failure reported by the backend, keeping the backend's own error name. */
    public static GatewayException business(String backendId, String operation, String errorName,
                                            String detail, Throwable cause) {
        return new GatewayException(GatewayErrorKind.BUSINESS_ERROR, backendId, operation, null,
                errorName, detail, cause);
    }

    public static GatewayException schemaViolation(String backendId, String operation, String field, String detail) {
        return new GatewayException(GatewayErrorKind.SCHEMA_VIOLATION, backendId, operation, field,
                "Backend response does not match declared schema: " + detail, null);
    }

    public GatewayErrorKind getKind() { return kind; }
    public String getBackendId() { return backendId; }
    public String getOperation() { return operation; }
    public String getField() { return field; }
    public String getBusinessError() { return businessError; }

    public Map<String, Object> toMap() {
        Map<String, Object> error = new HashMap<>();
        error.put("kind", kind.getCode());
        error.put("status", kind.getStatus().value());
        error.put("message", getMessage());
        if (backendId != null) error.put("backend", backendId);
        if (operation != null) error.put("operation", operation);
        if (field != null) error.put("field", field);
        if (businessError != null) error.put("businessError", businessError);
        return error;
    }

    private static String describe(GatewayErrorKind kind, String backendId, String operation, String detail) {
        StringBuilder sb = new StringBuilder(kind.getCode());
        if (backendId != null) {
            sb.append(" [backend=").append(backendId);
            if (operation != null) sb.append(", operation=").append(operation);
            sb.append(']');
        }
        if (detail != null && !detail.isBlank()) sb.append(": ").append(detail);
        return sb.toString();
    }
}
