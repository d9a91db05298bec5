package com.example.mcpgateway.backend;

import com.example.mcpgateway.model.BackendIdentity;
import com.example.mcpgateway.model.OperationDescriptor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.ConnectException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class HttpBackendTransportTest {

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();

    private HttpBackendTransport transport(HttpStatus status, String contentType, String body) {
        WebClient client = WebClient.builder()
                .baseUrl("http://backend.local:9000")
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, contentType)
                            .body(body)
                            .build());
                })
                .build();
        return new HttpBackendTransport(new BackendIdentity("docs", "http://backend.local:9000"), client,
                new McpMessages(new ObjectMapper()), "/mcp/message", "/sse", "mcp-gateway", "test");
    }

    private HttpBackendTransport json(String body) {
        return transport(HttpStatus.OK, MediaType.APPLICATION_JSON_VALUE, body);
    }

    @Test
    void testInitialize_PostsToMessageEndpoint() {
        HttpBackendTransport transport = json("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":"
                + "{\"protocolVersion\":\"2024-11-05\",\"serverInfo\":{\"name\":\"docs\"}}}");

        StepVerifier.create(transport.initialize()).verifyComplete();

        assertEquals(1, requests.size());
        assertEquals(HttpMethod.POST, requests.get(0).method());
        assertEquals("http://backend.local:9000/mcp/message", requests.get(0).url().toString());
    }

    @Test
    void testListOperations_ReadsToolsFromResult() {
        HttpBackendTransport transport = json("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"tools\":["
                + "{\"name\":\"search\",\"description\":\"Search docs\","
                + "\"inputSchema\":{\"type\":\"object\",\"properties\":{\"q\":{\"type\":\"string\"}}},"
                + "\"annotations\":{\"readOnlyHint\":true}}]}}");

        StepVerifier.create(transport.listOperations())
                .assertNext(ops -> {
                    assertEquals(1, ops.size());
                    OperationDescriptor search = ops.get(0);
                    assertEquals("search", search.getName());
                    assertEquals(Boolean.TRUE, search.getReadOnly());
                })
                .verifyComplete();
    }

    @Test
    void testInvoke_ReturnsStructuredContent() {
        HttpBackendTransport transport = json("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{"
                + "\"content\":[{\"type\":\"text\",\"text\":\"ignored\"}],"
                + "\"structuredContent\":{\"hits\":3}}}");

        StepVerifier.create(transport.invoke("search", Map.of("q", "java")))
                .expectNext(Map.of("hits", 3))
                .verifyComplete();
    }

    @Test
    void testInvoke_ToolErrorIsBusinessFailure() {
        HttpBackendTransport transport = json("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{"
                + "\"content\":[{\"type\":\"text\",\"text\":\"no such document\"}],\"isError\":true}}");

        StepVerifier.create(transport.invoke("fetch", Map.of("id", "42")))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(BackendBusinessException.class, e);
                    assertTrue(e.getMessage().contains("no such document"));
                })
                .verify();
    }

    @Test
    void testHttpFailure_IsTransportFailure() {
        HttpBackendTransport transport = transport(HttpStatus.INTERNAL_SERVER_ERROR,
                MediaType.TEXT_PLAIN_VALUE, "boom");

        StepVerifier.create(transport.ping())
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(BackendTransportException.class, e);
                    assertTrue(e.getMessage().contains("ping on backend docs failed"));
                })
                .verify();
    }

    @Test
    void testConnectionRefused_IsTransportFailure() {
        WebClient client = WebClient.builder()
                .baseUrl("http://backend.local:9000")
                .exchangeFunction(request -> Mono.error(new ConnectException("Connection refused")))
                .build();
        HttpBackendTransport transport = new HttpBackendTransport(new BackendIdentity("docs", "http://backend.local:9000"),
                client, new McpMessages(new ObjectMapper()), "/mcp/message", "/sse", "mcp-gateway", "test");

        StepVerifier.create(transport.initialize())
                .expectError(BackendTransportException.class)
                .verify();
    }

    @Test
    void testCapabilityChanges_EmitsOnlyListChanged() {
        HttpBackendTransport transport = transport(HttpStatus.OK, MediaType.TEXT_EVENT_STREAM_VALUE,
                "event: endpoint\ndata: /mcp/message\n\n"
                        + "event: message\ndata: {\"jsonrpc\":\"2.0\",\"method\":\"notifications/tools/list_changed\"}\n\n"
                        + "event: message\ndata: {\"jsonrpc\":\"2.0\",\"method\":\"notifications/progress\"}\n\n");

        StepVerifier.create(transport.capabilityChanges())
                .expectNext(McpMessages.LIST_CHANGED)
                .verifyComplete();
        assertEquals("http://backend.local:9000/sse", requests.get(0).url().toString());
    }
}
