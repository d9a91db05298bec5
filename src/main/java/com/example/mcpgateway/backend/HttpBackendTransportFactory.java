package com.example.mcpgateway.backend;

import com.example.mcpgateway.config.GatewayProperties;
import com.example.mcpgateway.model.BackendIdentity;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

@Component
public class HttpBackendTransportFactory implements BackendTransportFactory {

    private final WebClient.Builder webClientBuilder;
    private final McpMessages messages;
    private final GatewayProperties properties;

    public HttpBackendTransportFactory(WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
                                       GatewayProperties properties) {
        this.webClientBuilder = webClientBuilder;
        this.messages = new McpMessages(objectMapper);
        this.properties = properties;
    }

    @Override
    public BackendTransport create(BackendIdentity identity) {
        WebClient client = webClientBuilder.clone()
                .baseUrl(identity.getUrl())
                .build();
        return new HttpBackendTransport(identity, client, messages,
                properties.getMessagePath(), properties.getSsePath(),
                "mcp-gateway", properties.getVersion());
    }
}
