package com.example.mcpgateway.backend;

import com.example.mcpgateway.model.OperationDescriptor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class McpMessagesTest {

    private final McpMessages messages = new McpMessages(new ObjectMapper());

    @Test
    void testUnwrap_ReturnsEnvelopeResult() {
        Map<String, Object> response = Map.of("jsonrpc", "2.0", "id", 1, "result", Map.of("tools", List.of()));

        assertEquals(Map.of("tools", List.of()), messages.unwrap(response));
    }

    @Test
    void testUnwrap_AcceptsBareResultBody() {
        Map<String, Object> response = Map.of("tools", List.of());

        assertEquals(response, messages.unwrap(response));
    }

    @Test
    void testUnwrap_ErrorObjectIsBusinessFailure() {
        Map<String, Object> response = Map.of(
                "error", Map.of("code", -32601, "message", "Method not found: tools/call"),
                "isError", true);

        BackendBusinessException e = assertThrows(BackendBusinessException.class, () -> messages.unwrap(response));
        assertEquals("Method not found: tools/call", e.getMessage());
        assertEquals("RpcError -32601", e.getErrorName());
    }

    @Test
    void testReadOperations_SkipsMalformedEntries() {
        Map<String, Object> result = Map.of("tools", List.of(
                Map.of("name", "kv_get",
                        "description", "Get value for a key",
                        "inputSchema", Map.of("type", "object",
                                "properties", Map.of("key", Map.of("type", "string")),
                                "required", List.of("key")),
                        "annotations", Map.of("readOnlyHint", true)),
                Map.of("description", "no name"),
                "not-a-tool",
                Map.of("name", "kv_set")));

        List<OperationDescriptor> operations = messages.readOperations(result);

        assertEquals(2, operations.size());
        OperationDescriptor get = operations.get(0);
        assertEquals("kv_get", get.getName());
        assertEquals(Boolean.TRUE, get.getReadOnly());
        assertNotNull(get.getInputSchema());
        assertNull(get.getOutputSchema());
        assertEquals("kv_set", operations.get(1).getName());
        assertNull(operations.get(1).getReadOnly());
    }

    @Test
    void testReadOperations_MissingToolsListIsEmpty() {
        assertTrue(messages.readOperations(Map.of("unexpected", 1)).isEmpty());
    }

    @Test
    void testReadCallResult_PrefersStructuredContent() {
        Map<String, Object> result = Map.of(
                "content", List.of(Map.of("type", "text", "text", "ignored")),
                "structuredContent", Map.of("text", "abc"));

        assertEquals(Map.of("text", "abc"), messages.readCallResult("echo", result));
    }

    @Test
    void testReadCallResult_DecodesSingleJsonTextPart() {
        // shape produced by servers that put a serialized result into a single content object
        Map<String, Object> result = Map.of(
                "content", Map.of("type", "text", "text", "{\"key\":\"a\",\"value\":\"b\"}"),
                "isError", false);

        assertEquals(Map.of("key", "a", "value", "b"), messages.readCallResult("kv_get", result));
    }

    @Test
    void testReadCallResult_KeepsNonJsonContent() {
        Map<String, Object> result = Map.of("content", List.of(Map.of("type", "text", "text", "hello")));

        Map<String, Object> payload = messages.readCallResult("greet", result);

        assertEquals(List.of(Map.of("type", "text", "text", "hello")), payload.get("content"));
    }

    @Test
    void testReadCallResult_IsErrorBecomesBusinessFailure() {
        Map<String, Object> result = Map.of(
                "content", List.of(Map.of("type", "text", "text", "Collection not allowed: secrets")),
                "isError", true);

        BackendBusinessException e = assertThrows(BackendBusinessException.class,
                () -> messages.readCallResult("store_find", result));
        assertEquals("Collection not allowed: secrets", e.getMessage());
    }

    @Test
    void testRequest_BuildsJsonRpcEnvelope() {
        Map<String, Object> request = messages.request(7, "tools/call", messages.callParams("echo", Map.of("text", "x")));

        assertEquals("2.0", request.get("jsonrpc"));
        assertEquals(7L, request.get("id"));
        assertEquals("tools/call", request.get("method"));
        assertEquals(Map.of("name", "echo", "arguments", Map.of("text", "x")), request.get("params"));
    }
}
