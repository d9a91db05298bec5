package com.example.mcpgateway.backend;

/**
 * Domain failure reported by the backend itself. The message is passed through
 * to the caller unchanged.
 */
public class BackendBusinessException extends RuntimeException {

    private final String errorName;

    public BackendBusinessException(String errorName, String message) {
        super(message);
        this.errorName = errorName;
    }

    public String getErrorName() {
        return errorName;
    }
}
