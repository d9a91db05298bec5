package com.example.mcpgateway.model;

import lombok.Getter;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-request state owned by the dispatcher for the lifetime of one inbound call.
 */
@Getter
public class InvocationContext {

    private final String correlationId;
    private final String backendId;
    private final String operationName;
    private final Map<String, Object> payload;
    private final Instant deadline;

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicBoolean cancelled = new AtomicBoolean();
    @Getter(lombok.AccessLevel.NONE)
    private final Sinks.One<Boolean> cancellation = Sinks.one();

    public InvocationContext(String correlationId, String backendId, String operationName,
                             Map<String, Object> payload, Instant deadline) {
        this.correlationId = correlationId;
        this.backendId = backendId;
        this.operationName = operationName;
        this.payload = payload == null ? Map.of() : payload;
        this.deadline = deadline;
    }

    public Duration remaining() {
        Duration left = Duration.between(Instant.now(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            cancellation.tryEmitValue(Boolean.TRUE);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /** Emits once when the inbound request is cancelled. Never signals otherwise. */
    public Mono<Boolean> onCancel() {
        return cancellation.asMono();
    }
}
