package com.example.mcpgateway.model;

public enum BackendState {
    DISCONNECTED,
    CONNECTING,
    DISCOVERING,
    READY,
    DEGRADED,
    RECONNECTING;

    /** States in which the session accepts invocation calls. */
    public boolean acceptsInvocations() {
        return this == READY || this == DEGRADED;
    }
}
