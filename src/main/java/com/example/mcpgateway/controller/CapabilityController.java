package com.example.mcpgateway.controller;

import com.example.mcpgateway.service.CapabilityPublisher;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class CapabilityController {

    private final CapabilityPublisher publisher;

    public CapabilityController(CapabilityPublisher publisher) {
        this.publisher = publisher;
    }

    @GetMapping(value = "/openapi.json", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> openApi() {
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(publisher.renderJson());
    }
}
