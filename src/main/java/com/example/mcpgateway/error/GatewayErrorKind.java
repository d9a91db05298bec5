package com.example.mcpgateway.error;

import org.springframework.http.HttpStatus;

public enum GatewayErrorKind {
    BACKEND_UNREACHABLE("BackendUnreachable", HttpStatus.SERVICE_UNAVAILABLE),
    BACKEND_UNAVAILABLE("BackendUnavailable", HttpStatus.SERVICE_UNAVAILABLE),
    BACKEND_OVERLOADED("BackendOverloaded", HttpStatus.TOO_MANY_REQUESTS),
    UNKNOWN_ROUTE("UnknownRoute", HttpStatus.NOT_FOUND),
    VALIDATION_ERROR("ValidationError", HttpStatus.BAD_REQUEST),
    SCHEMA_VIOLATION("SchemaViolation", HttpStatus.BAD_GATEWAY),
    INVOCATION_TIMEOUT("InvocationTimeout", HttpStatus.GATEWAY_TIMEOUT),
    BUSINESS_ERROR("BusinessError", HttpStatus.UNPROCESSABLE_ENTITY);

    private final String code;
    private final HttpStatus status;

    GatewayErrorKind(String code, HttpStatus status) {
        this.code = code;
        this.status = status;
    }

    public String getCode() { return code; }
    public HttpStatus getStatus() { return status; }
}
