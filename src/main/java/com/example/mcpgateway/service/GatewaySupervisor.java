package com.example.mcpgateway.service;

import com.example.mcpgateway.backend.BackendSession;
import com.example.mcpgateway.backend.BackendTransportFactory;
import com.example.mcpgateway.config.GatewayProperties;
import com.example.mcpgateway.error.GatewayException;
import com.example.mcpgateway.model.BackendIdentity;
import com.example.mcpgateway.model.BackendState;
import com.example.mcpgateway.model.OperationDescriptor;
import com.example.mcpgateway.model.RouteDescriptor;
import com.example.mcpgateway.registry.RouteRegistry;
import com.example.mcpgateway.translate.SchemaTranslator;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Owns the backend sessions and is the only component that writes to the
 * {@link RouteRegistry}. Writes are serialized on {@code registryLock}; a
 * callback from a session that has since been replaced or removed is ignored.
 */
@Service
public class GatewaySupervisor implements BackendSession.Listener {

    private static final Logger logger = LoggerFactory.getLogger(GatewaySupervisor.class);

    private static final Pattern BACKEND_ID = Pattern.compile("[A-Za-z0-9_-]+");
    private static final Set<String> RESERVED_IDS = Set.of("health", "openapi.json", "admin", "actuator");

    private final GatewayProperties properties;
    private final BackendTransportFactory transportFactory;
    private final SchemaTranslator translator;
    private final RouteRegistry registry;

    private final Map<String, BackendSession> sessions = new ConcurrentHashMap<>();
    private final Object registryLock = new Object();

    public GatewaySupervisor(GatewayProperties properties, BackendTransportFactory transportFactory,
                             SchemaTranslator translator, RouteRegistry registry) {
        this.properties = properties;
        this.transportFactory = transportFactory;
        this.translator = translator;
        this.registry = registry;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startConfiguredBackends() {
        logger.info("Starting {} configured backend(s)", properties.getBackends().size());
        for (BackendIdentity identity : properties.getBackends()) {
            try {
                addBackend(identity);
            } catch (GatewayException e) {
                logger.error("Skipping configured backend {}: {}", identity.getId(), e.getMessage());
            }
        }
    }

    /**
     * Starts a session for the identity. An existing session with the same id
     * is stopped and its routes purged before the new one discovers.
     */
    public BackendSession addBackend(BackendIdentity identity) {
        validate(identity);
        BackendSession session = new BackendSession(identity, transportFactory.create(identity), properties, this);
        BackendSession previous;
        synchronized (registryLock) {
            previous = sessions.put(identity.getId(), session);
            registry.removeBackend(identity.getId());
        }
        if (previous != null) {
            logger.info("Replacing backend {} ({} -> {})", identity.getId(),
                    previous.getIdentity().getUrl(), identity.getUrl());
            previous.stop();
        } else {
            logger.info("Adding backend {} at {}", identity.getId(), identity.getUrl());
        }
        session.start();
        return session;
    }

    public boolean removeBackend(String backendId) {
        BackendSession removed;
        synchronized (registryLock) {
            removed = sessions.remove(backendId);
            registry.removeBackend(backendId);
        }
        if (removed == null) {
            return false;
        }
        logger.info("Removed backend {}", backendId);
        removed.stop();
        return true;
    }

    public boolean rediscover(String backendId) {
        BackendSession session = sessions.get(backendId);
        if (session == null) return false;
        session.requestRediscovery();
        return true;
    }

    public Optional<BackendSession> session(String backendId) {
        return Optional.ofNullable(sessions.get(backendId));
    }

    public Collection<BackendSession> sessions() {
        return Collections.unmodifiableCollection(sessions.values());
    }

    @Override
    public void onOperationsDiscovered(BackendSession session, List<OperationDescriptor> operations) {
        List<RouteDescriptor> routes = translator.translateAll(session.getId(), operations);
        synchronized (registryLock) {
            if (sessions.get(session.getId()) != session) {
                logger.debug("Ignoring discovery from retired session of backend {}", session.getId());
                return;
            }
            registry.replaceBackend(session, routes);
        }
    }

    @Override
    public void onOperationsWithdrawn(BackendSession session) {
        synchronized (registryLock) {
            if (sessions.get(session.getId()) != session) return;
            registry.removeBackend(session.getId());
        }
    }

    public Map<String, Object> health() {
        Map<String, Object> backends = new TreeMap<>();
        boolean allReady = true;
        RouteRegistry.Snapshot snapshot = registry.snapshot();
        for (BackendSession session : sessions.values()) {
            Map<String, Object> entry = session.describeHealth();
            entry.put("routes", snapshot.routesOf(session.getId()).size());
            backends.put(session.getId(), entry);
            allReady &= session.getState() == BackendState.READY;
        }
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", allReady ? "UP" : "DEGRADED");
        health.put("routes", snapshot.size());
        health.put("backends", backends);
        return health;
    }

    @PreDestroy
    public void shutdown() {
        List<String> ids = new ArrayList<>(sessions.keySet());
        ids.forEach(this::removeBackend);
    }

    private void validate(BackendIdentity identity) {
        String id = identity.getId();
        if (id == null || !BACKEND_ID.matcher(id).matches()) {
            throw GatewayException.validation(null, null, "id",
                    "backend id must match " + BACKEND_ID.pattern() + ": " + id);
        }
        if (RESERVED_IDS.contains(id)) {
            throw GatewayException.validation(null, null, "id", "backend id is reserved: " + id);
        }
        if (identity.getUrl() == null || identity.getUrl().isBlank()) {
            throw GatewayException.validation(id, null, "url", "backend url is required");
        }
    }
}
