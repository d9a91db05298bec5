package com.example.mcpgateway.backend;

import com.example.mcpgateway.model.OperationDescriptor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Client side of the backend protocol. Transport failures surface as
 * {@link BackendTransportException}, backend-reported failures as
 * {@link BackendBusinessException}.
 */
public interface BackendTransport {

    Mono<Void> initialize();

    /** Malformed entries are skipped; a malformed listing yields an empty list. */
    Mono<List<OperationDescriptor>> listOperations();

    Mono<Map<String, Object>> invoke(String operation, Map<String, Object> arguments);

    Mono<Void> ping();

    /** Emits once per "capabilities changed" push from the backend. */
    default Flux<String> capabilityChanges() {
        return Flux.empty();
    }

    default void close() {
    }
}
