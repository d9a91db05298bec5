package com.example.mcpgateway.controller;

import com.example.mcpgateway.service.GatewaySupervisor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final GatewaySupervisor supervisor;

    public HealthController(GatewaySupervisor supervisor) {
        this.supervisor = supervisor;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("service", "mcp-gateway");
        health.putAll(supervisor.health());
        return ResponseEntity.ok(health);
    }

    @GetMapping("/actuator/health")
    public ResponseEntity<Map<String, Object>> actuatorHealth() {
        return health();
    }
}
