package com.example.mcpgateway.controller;

import com.example.mcpgateway.backend.BackendSession;
import com.example.mcpgateway.model.BackendIdentity;
import com.example.mcpgateway.service.GatewaySupervisor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;
import java.util.TreeMap;

/**
 * Adds and removes backends at runtime. Configured backends are started by the
 * supervisor at boot; this surface is for everything after that.
 */
@RestController
@RequestMapping("/admin/backends")
public class BackendAdminController {

    private final GatewaySupervisor supervisor;

    public BackendAdminController(GatewaySupervisor supervisor) {
        this.supervisor = supervisor;
    }

    @GetMapping
    public Map<String, Object> list() {
        Map<String, Object> backends = new TreeMap<>();
        for (BackendSession session : supervisor.sessions()) {
            backends.put(session.getId(), session.describeHealth());
        }
        return Map.of("backends", backends);
    }

    // replacing or removing a backend waits for its worker to stop, so both run off the event loop
    @PostMapping
    public Mono<ResponseEntity<Map<String, Object>>> add(@RequestBody BackendIdentity identity) {
        return Mono.fromCallable(() -> supervisor.addBackend(identity))
                .subscribeOn(Schedulers.boundedElastic())
                .map(session -> ResponseEntity.status(HttpStatus.ACCEPTED)
                        .body(Map.<String, Object>of("id", session.getId(), "state", session.getState().name())));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> remove(@PathVariable String id) {
        return Mono.fromCallable(() -> supervisor.removeBackend(id))
                .subscribeOn(Schedulers.boundedElastic())
                .map(removed -> removed
                        ? ResponseEntity.noContent().<Void>build()
                        : ResponseEntity.notFound().<Void>build());
    }

    @PostMapping("/{id}/rediscover")
    public ResponseEntity<Map<String, Object>> rediscover(@PathVariable String id) {
        return supervisor.rediscover(id)
                ? ResponseEntity.accepted().body(Map.of("id", id, "rediscovery", "requested"))
                : ResponseEntity.notFound().build();
    }
}
