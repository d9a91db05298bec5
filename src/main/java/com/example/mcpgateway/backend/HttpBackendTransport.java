package com.example.mcpgateway.backend;

import com.example.mcpgateway.model.BackendIdentity;
import com.example.mcpgateway.model.OperationDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON-RPC over HTTP POST, with list-changed notifications read from the
 * backend's SSE stream.
 */
public class HttpBackendTransport implements BackendTransport {

    private static final Logger logger = LoggerFactory.getLogger(HttpBackendTransport.class);

    private static final ParameterizedTypeReference<Map<String, Object>> MAP_TYPE =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
            new ParameterizedTypeReference<>() {};

    private final BackendIdentity identity;
    private final WebClient webClient;
    private final McpMessages messages;
    private final String messagePath;
    private final String ssePath;
    private final String clientName;
    private final String clientVersion;
    private final AtomicLong ids = new AtomicLong();

    public HttpBackendTransport(BackendIdentity identity, WebClient webClient, McpMessages messages,
                                String messagePath, String ssePath, String clientName, String clientVersion) {
        this.identity = identity;
        this.webClient = webClient;
        this.messages = messages;
        this.messagePath = messagePath;
        this.ssePath = ssePath;
        this.clientName = clientName;
        this.clientVersion = clientVersion;
    }

    @Override
    public Mono<Void> initialize() {
        return call("initialize", messages.initializeParams(clientName, clientVersion))
                .doOnNext(result -> logger.debug("Backend {} initialized: serverInfo={}",
                        identity.getId(), result.get("serverInfo")))
                .then();
    }

    @Override
    public Mono<List<OperationDescriptor>> listOperations() {
        return call("tools/list", Map.of()).map(messages::readOperations);
    }

    @Override
    public Mono<Map<String, Object>> invoke(String operation, Map<String, Object> arguments) {
        return call("tools/call", messages.callParams(operation, arguments))
                .map(result -> messages.readCallResult(operation, result));
    }

    @Override
    public Mono<Void> ping() {
        return call("ping", null).then();
    }

    @Override
    public Flux<String> capabilityChanges() {
        return webClient.get()
                .uri(ssePath)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .retrieve()
                .bodyToFlux(SSE_TYPE)
                .filter(this::isListChanged)
                .map(event -> McpMessages.LIST_CHANGED)
                .onErrorMap(e -> !(e instanceof BackendTransportException),
                        e -> new BackendTransportException(
                                "Notification stream of backend " + identity.getId() + " failed", e));
    }

    private boolean isListChanged(ServerSentEvent<String> event) {
        if (McpMessages.LIST_CHANGED.equals(event.event())) return true;
        String data = event.data();
        return data != null && data.contains(McpMessages.LIST_CHANGED);
    }

    private Mono<Map<String, Object>> call(String method, Map<String, Object> params) {
        Map<String, Object> request = messages.request(ids.incrementAndGet(), method, params);
        return webClient.post()
                .uri(messagePath)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(MAP_TYPE)
                .switchIfEmpty(Mono.error(() -> new BackendTransportException(
                        "Backend " + identity.getId() + " returned no body for " + method)))
                .onErrorMap(e -> !(e instanceof BackendTransportException || e instanceof BackendBusinessException),
                        e -> new BackendTransportException(
                                method + " on backend " + identity.getId() + " failed: " + e.getMessage(), e))
                .map(messages::unwrap);
    }
}
