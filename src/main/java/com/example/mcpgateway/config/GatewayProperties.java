package com.example.mcpgateway.config;

import com.example.mcpgateway.model.BackendIdentity;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    private String title = "MCP Capability Gateway";
    private String version = "1.0.0";

    private List<BackendIdentity> backends = new ArrayList<>();

    private Duration defaultTimeout = Duration.ofSeconds(30);
    private int concurrencyLimit = 16;
    private Duration overloadWait = Duration.ofMillis(250);

    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration discoveryTimeout = Duration.ofSeconds(10);
    private Duration rediscoveryInterval = Duration.ofSeconds(60);
    private Duration probeInterval = Duration.ofSeconds(5);
    private int probeFailureThreshold = 3;

    private String messagePath = "/mcp/message";
    private String ssePath = "/sse";

    private Backoff backoff = new Backoff();

    @Data
    public static class Backoff {
        private Duration initial = Duration.ofMillis(500);
        private Duration max = Duration.ofSeconds(30);
        // fraction of the computed delay randomized in both directions
        private double jitter = 0.2;
    }
}
