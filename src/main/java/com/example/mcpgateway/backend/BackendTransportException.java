package com.example.mcpgateway.backend;

/**
 * Connection refused, broken stream, non-2xx HTTP status: anything where the
 * backend did not produce a protocol-level answer.
 */
public class BackendTransportException extends RuntimeException {

    public BackendTransportException(String message) {
        super(message);
    }

    public BackendTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
