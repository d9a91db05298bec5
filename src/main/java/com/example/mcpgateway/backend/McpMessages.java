package com.example.mcpgateway.backend;

import com.example.mcpgateway.model.OperationDescriptor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Builds JSON-RPC requests and reads the results of {@code initialize},
 * {@code tools/list} and {@code tools/call}. Accepts both enveloped
 * ({@code {"jsonrpc":"2.0","result":...}}) and bare result bodies.
 */
public class McpMessages {

    private static final Logger logger = LoggerFactory.getLogger(McpMessages.class);

    public static final String PROTOCOL_VERSION = "2024-11-05";
    public static final String LIST_CHANGED = "notifications/tools/list_changed";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public McpMessages(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> request(long id, String method, Map<String, Object> params) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", "2.0");
        request.put("id", id);
        request.put("method", method);
        if (params != null) request.put("params", params);
        return request;
    }

    public Map<String, Object> initializeParams(String clientName, String clientVersion) {
        return Map.of(
                "protocolVersion", PROTOCOL_VERSION,
                "capabilities", Map.of(),
                "clientInfo", Map.of("name", clientName, "version", clientVersion)
        );
    }

    public Map<String, Object> callParams(String operation, Map<String, Object> arguments) {
        return Map.of("name", operation, "arguments", arguments == null ? Map.of() : arguments);
    }

    /**
     * Unwraps the JSON-RPC envelope. A protocol error object becomes a
     * {@link BackendBusinessException}.
     */
    public Map<String, Object> unwrap(Map<String, Object> response) {
        if (response == null) {
            throw new BackendTransportException("Empty response body");
        }
        Object error = response.get("error");
        if (error instanceof Map<?, ?> err) {
            Object code = err.get("code");
            String message = Objects.toString(err.get("message"), "Unknown error");
            throw new BackendBusinessException(code == null ? "RpcError" : "RpcError " + code, message);
        }
        if (error != null) {
            throw new BackendBusinessException("RpcError", error.toString());
        }
        Object result = response.get("result");
        if (result instanceof Map<?, ?>) {
            return asMap(result);
        }
        if (response.containsKey("jsonrpc")) {
            return Map.of();
        }
        return response;
    }

    public List<OperationDescriptor> readOperations(Map<String, Object> result) {
        Object tools = result.get("tools");
        if (!(tools instanceof List<?> list)) {
            logger.warn("Discovery result has no tools list, treating as empty: keys={}", result.keySet());
            return List.of();
        }
        List<OperationDescriptor> operations = new ArrayList<>();
        for (Object entry : list) {
            if (!(entry instanceof Map<?, ?>)) {
                logger.warn("Skipping malformed tool entry: {}", entry);
                continue;
            }
            Map<String, Object> tool = asMap(entry);
            Object name = tool.get("name");
            if (!(name instanceof String n) || n.isBlank()) {
                logger.warn("Skipping tool without a name: {}", tool);
                continue;
            }
            Boolean readOnly = null;
            if (tool.get("annotations") instanceof Map<?, ?> annotations
                    && annotations.get("readOnlyHint") instanceof Boolean hint) {
                readOnly = hint;
            }
            operations.add(OperationDescriptor.builder()
                    .name(n)
                    .description(tool.get("description") instanceof String d ? d : null)
                    .inputSchema(tool.get("inputSchema") instanceof Map<?, ?> in ? asMap(in) : null)
                    .outputSchema(tool.get("outputSchema") instanceof Map<?, ?> out ? asMap(out) : null)
                    .readOnly(readOnly)
                    .build());
        }
        return operations;
    }

    /**
     * Turns a {@code tools/call} result into the response payload. Structured
     * content wins; otherwise a single JSON-object text part is decoded and any
     * other content is returned as-is under {@code content}.
     */
    public Map<String, Object> readCallResult(String operation, Map<String, Object> result) {
        List<Map<String, Object>> parts = contentParts(result.get("content"));
        if (Boolean.TRUE.equals(result.get("isError"))) {
            String message = textOf(parts);
            if (message.isEmpty() && result.get("error") instanceof Map<?, ?> err) {
                message = Objects.toString(err.get("message"), "");
            }
            throw new BackendBusinessException("ToolError",
                    message.isEmpty() ? "Operation " + operation + " failed" : message);
        }
        if (result.get("structuredContent") instanceof Map<?, ?> structured) {
            return asMap(structured);
        }
        if (parts.size() == 1 && "text".equals(parts.get(0).get("type"))) {
            String text = Objects.toString(parts.get(0).get("text"), "");
            Map<String, Object> decoded = tryDecodeObject(text);
            if (decoded != null) return decoded;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("content", parts);
        return payload;
    }

    private List<Map<String, Object>> contentParts(Object content) {
        if (content instanceof Map<?, ?> single) {
            return List.of(asMap(single));
        }
        if (content instanceof List<?> list) {
            List<Map<String, Object>> parts = new ArrayList<>();
            for (Object item : list) {
                if (item instanceof Map<?, ?> m) parts.add(asMap(m));
            }
            return parts;
        }
        return List.of();
    }

    private String textOf(List<Map<String, Object>> parts) {
        StringBuilder sb = new StringBuilder();
        for (Map<String, Object> part : parts) {
            if ("text".equals(part.get("type")) && part.get("text") != null) {
                if (sb.length() > 0) sb.append('\n');
                sb.append(part.get("text"));
            }
        }
        return sb.toString();
    }

    private Map<String, Object> tryDecodeObject(String text) {
        String trimmed = text.trim();
        if (!trimmed.startsWith("{")) return null;
        try {
            return objectMapper.readValue(trimmed, MAP_TYPE);
        } catch (JsonProcessingException e) {
            logger.debug("Text content is not a JSON object: {}", e.getOriginalMessage());
            return null;
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }
}
