package com.example.mcpgateway.support;

import com.example.mcpgateway.backend.BackendBusinessException;
import com.example.mcpgateway.backend.BackendTransport;
import com.example.mcpgateway.backend.BackendTransportException;
import com.example.mcpgateway.model.OperationDescriptor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * In-memory backend. Operations without a handler echo their arguments.
 */
public class SyntheticBackend implements BackendTransport {

    public final AtomicInteger initializeCalls = new AtomicInteger();
    public final AtomicInteger discoveryCalls = new AtomicInteger();
    public final AtomicInteger invocations = new AtomicInteger();
    public final AtomicInteger pings = new AtomicInteger();
    public final AtomicInteger cancellations = new AtomicInteger();

    private final Map<String, Function<Map<String, Object>, Mono<Map<String, Object>>>> handlers =
            new ConcurrentHashMap<>();
    private final Sinks.Many<String> changes = Sinks.many().multicast().directBestEffort();

    private volatile List<OperationDescriptor> operations;
    private volatile boolean reachable = true;
    private volatile boolean pingHealthy = true;
    private volatile boolean failInvocations;
    private volatile boolean pingUnsupported;

    public SyntheticBackend(OperationDescriptor... operations) {
        this.operations = List.of(operations);
    }

    public static OperationDescriptor echo() {
        return operation("echo", Map.of("text", Map.of("type", "string")), false);
    }

    /** Object-typed operation whose fields are all required; the output schema mirrors the input. */
    public static OperationDescriptor operation(String name, Map<String, Object> fields, boolean readOnly) {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", fields,
                "required", List.copyOf(fields.keySet()));
        return OperationDescriptor.builder()
                .name(name)
                .description("Synthetic " + name)
                .inputSchema(schema)
                .outputSchema(schema)
                .readOnly(readOnly)
                .build();
    }

    public SyntheticBackend handle(String operation, Function<Map<String, Object>, Mono<Map<String, Object>>> handler) {
        handlers.put(operation, handler);
        return this;
    }

    public void setOperations(OperationDescriptor... operations) {
        this.operations = List.of(operations);
    }

    public void setReachable(boolean reachable) {
        this.reachable = reachable;
    }

    public void setPingHealthy(boolean pingHealthy) {
        this.pingHealthy = pingHealthy;
    }

    /** Answers ping with a JSON-RPC "method not found" error, as servers without ping support do. */
    public void setPingUnsupported(boolean pingUnsupported) {
        this.pingUnsupported = pingUnsupported;
    }

    public void setFailInvocations(boolean failInvocations) {
        this.failInvocations = failInvocations;
    }

    public void pushListChanged() {
        changes.tryEmitNext("notifications/tools/list_changed");
    }

    @Override
    public Mono<Void> initialize() {
        return Mono.defer(() -> {
            initializeCalls.incrementAndGet();
            return reachable ? Mono.<Void>empty() : Mono.error(new BackendTransportException("Connection refused"));
        });
    }

    @Override
    public Mono<List<OperationDescriptor>> listOperations() {
        return Mono.defer(() -> {
            discoveryCalls.incrementAndGet();
            return reachable ? Mono.just(operations) : Mono.error(new BackendTransportException("Connection refused"));
        });
    }

    @Override
    public Mono<Map<String, Object>> invoke(String operation, Map<String, Object> arguments) {
        return Mono.defer(() -> {
            invocations.incrementAndGet();
            if (!reachable || failInvocations) {
                return Mono.<Map<String, Object>>error(new BackendTransportException("Connection reset"));
            }
            if ("fail".equals(arguments.get("mode"))) {
                return Mono.<Map<String, Object>>error(new BackendBusinessException("ToolError", "record not found"));
            }
            Function<Map<String, Object>, Mono<Map<String, Object>>> handler = handlers.get(operation);
            return handler != null ? handler.apply(arguments) : Mono.just(arguments);
        }).doOnCancel(cancellations::incrementAndGet);
    }

    @Override
    public Mono<Void> ping() {
        return Mono.defer(() -> {
            pings.incrementAndGet();
            if (reachable && pingUnsupported) {
                return Mono.<Void>error(new BackendBusinessException("RpcError -32601", "Method not found: ping"));
            }
            return reachable && pingHealthy
                    ? Mono.<Void>empty()
                    : Mono.error(new BackendTransportException("Ping failed"));
        });
    }

    @Override
    public Flux<String> capabilityChanges() {
        return changes.asFlux();
    }
}
