package com.example.mcpgateway.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Canonical, protocol-agnostic form of one backend operation. Drives both
 * dispatch and the published API description.
 */
@Value
@Builder(toBuilder = true)
public class RouteDescriptor {
    String backendId;
    String operationName;
    String path;
    RouteMethod method;
    String summary;
    String description;
    Map<String, Object> requestSchema;
    Map<String, Object> responseSchema;
    Map<String, Object> errorSchema;

    public RouteKey key() {
        return new RouteKey(method, path);
    }
}
