package com.example.mcpgateway.service;

import com.example.mcpgateway.backend.BackendSession;
import com.example.mcpgateway.config.GatewayProperties;
import com.example.mcpgateway.error.GatewayErrorKind;
import com.example.mcpgateway.error.GatewayException;
import com.example.mcpgateway.model.BackendIdentity;
import com.example.mcpgateway.model.BackendState;
import com.example.mcpgateway.model.OperationDescriptor;
import com.example.mcpgateway.model.RouteMethod;
import com.example.mcpgateway.registry.RouteEntry;
import com.example.mcpgateway.support.Await;
import com.example.mcpgateway.support.GatewayFixture;
import com.example.mcpgateway.support.SyntheticBackend;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class GatewaySupervisorTest {

    private GatewayFixture fixture = new GatewayFixture();

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private static OperationDescriptor op(String name) {
        return SyntheticBackend.operation(name, Map.of("text", Map.of("type", "string")), false);
    }

    private Set<String> routedOperations(String backendId) {
        return fixture.registry.snapshot().routesOf(backendId).stream()
                .map(entry -> entry.getRoute().getOperationName())
                .collect(Collectors.toSet());
    }

    @Test
    void testAddBackend_PublishesRoutesOnceReady() {
        // When
        BackendSession session = fixture.addReady("alpha", new SyntheticBackend(op("a"), op("b")));

        // Then
        assertEquals(Set.of("a", "b"), routedOperations("alpha"));
        RouteEntry entry = fixture.registry.lookup(RouteMethod.POST, "/alpha/a").orElseThrow();
        assertSame(session, entry.getSession());
        assertSame(session, fixture.supervisor.session("alpha").orElseThrow());
    }

    @Test
    void testRediscover_SwapsCapabilitySet() {
        // Given
        SyntheticBackend backend = new SyntheticBackend(op("a"), op("b"));
        fixture.addReady("alpha", backend);

        // When
        backend.setOperations(op("b"), op("c"));
        assertTrue(fixture.supervisor.rediscover("alpha"));

        // Then
        Await.until(() -> routedOperations("alpha").equals(Set.of("b", "c")));
        assertTrue(fixture.registry.lookup(RouteMethod.POST, "/alpha/a").isEmpty());
        assertFalse(fixture.supervisor.rediscover("unknown"));
    }

    @Test
    void testReAddingBackend_PurgesRoutesOfPreviousSession() {
        // Given
        BackendSession first = fixture.addReady("alpha", new SyntheticBackend(op("a"), op("b")));

        // When
        BackendSession second = fixture.addReady("alpha", new SyntheticBackend(op("c")));

        // Then
        assertEquals(BackendState.DISCONNECTED, first.getState());
        assertEquals(Set.of("c"), routedOperations("alpha"));
        assertSame(second, fixture.registry.lookup(RouteMethod.POST, "/alpha/c").orElseThrow().getSession());
    }

    @Test
    void testCallbackFromRetiredSession_IsIgnored() {
        // Given
        BackendSession first = fixture.addReady("alpha", new SyntheticBackend(op("a")));
        fixture.addReady("alpha", new SyntheticBackend(op("b")));

        // When
        fixture.supervisor.onOperationsDiscovered(first, List.of(op("stale")));
        fixture.supervisor.onOperationsWithdrawn(first);

        // Then
        assertEquals(Set.of("b"), routedOperations("alpha"));
    }

    @Test
    void testRemoveBackend_WithdrawsRoutesImmediately() {
        // Given
        BackendSession session = fixture.addReady("alpha", new SyntheticBackend(SyntheticBackend.echo()));

        // When
        assertTrue(fixture.supervisor.removeBackend("alpha"));

        // Then
        assertTrue(fixture.registry.snapshot().routesOf("alpha").isEmpty());
        assertEquals(BackendState.DISCONNECTED, session.getState());
        assertFalse(fixture.supervisor.removeBackend("alpha"));
        StepVerifier.create(fixture.dispatcher.dispatch("POST", "/alpha/echo",
                        Map.of("text", "abc"), null, null, "corr-1"))
                .expectErrorSatisfies(e -> assertEquals(GatewayErrorKind.UNKNOWN_ROUTE,
                        ((GatewayException) e).getKind()))
                .verify();
    }

    @Test
    void testInvalidBackendIdentities_AreRejected() {
        for (BackendIdentity identity : List.of(
                new BackendIdentity("health", "synthetic://x"),
                new BackendIdentity("openapi.json", "synthetic://x"),
                new BackendIdentity("has space", "synthetic://x"),
                new BackendIdentity(null, "synthetic://x"),
                new BackendIdentity("alpha", " "))) {
            GatewayException e = assertThrows(GatewayException.class, () -> fixture.supervisor.addBackend(identity));
            assertEquals(GatewayErrorKind.VALIDATION_ERROR, e.getKind());
        }
        assertTrue(fixture.supervisor.sessions().isEmpty());
    }

    @Test
    void testHealth_ReportsPerBackendState() {
        // Given
        fixture.addReady("alpha", new SyntheticBackend(SyntheticBackend.echo()));
        Map<String, Object> ready = fixture.supervisor.health();

        SyntheticBackend down = new SyntheticBackend(SyntheticBackend.echo());
        down.setReachable(false);
        fixture.backends.put("beta", down);
        BackendSession beta = fixture.supervisor.addBackend(new BackendIdentity("beta", "synthetic://beta"));
        Await.until(() -> beta.getState() == BackendState.RECONNECTING);

        // When
        Map<String, Object> degraded = fixture.supervisor.health();

        // Then
        assertEquals("UP", ready.get("status"));
        assertEquals(1, ready.get("routes"));
        assertEquals("DEGRADED", degraded.get("status"));
        @SuppressWarnings("unchecked")
        Map<String, Map<String, Object>> backends = (Map<String, Map<String, Object>>) degraded.get("backends");
        assertEquals("READY", backends.get("alpha").get("state"));
        assertEquals(1, backends.get("alpha").get("routes"));
        assertEquals("RECONNECTING", backends.get("beta").get("state"));
        assertTrue(((String) backends.get("beta").get("lastError")).startsWith("BackendUnreachable"));
    }

    @Test
    void testFailingBackend_DoesNotAffectOthers() {
        // Given
        fixture.close();
        GatewayProperties properties = GatewayFixture.quietProperties();
        properties.setProbeInterval(Duration.ofMillis(20));
        fixture = new GatewayFixture(properties);
        fixture.addReady("alpha", new SyntheticBackend(SyntheticBackend.echo()));
        SyntheticBackend failing = new SyntheticBackend(SyntheticBackend.echo());
        BackendSession beta = fixture.addReady("beta", failing);

        // When
        failing.setFailInvocations(true);
        failing.setPingHealthy(false);
        StepVerifier.create(fixture.dispatcher.dispatch("POST", "/beta/echo",
                        Map.of("text", "abc"), null, null, "corr-2"))
                .expectErrorSatisfies(e -> assertEquals(GatewayErrorKind.BACKEND_UNAVAILABLE,
                        ((GatewayException) e).getKind()))
                .verify();
        Await.until(() -> beta.getState() == BackendState.RECONNECTING);

        // Then
        assertTrue(fixture.registry.snapshot().routesOf("beta").isEmpty());
        for (int i = 0; i < 20; i++) {
            StepVerifier.create(fixture.dispatcher.dispatch("POST", "/alpha/echo",
                            Map.of("text", "call-" + i), null, null, "corr-a" + i))
                    .expectNext(Map.of("text", "call-" + i))
                    .verifyComplete();
        }
        assertEquals(BackendState.READY, fixture.supervisor.session("alpha").orElseThrow().getState());
    }

    @Test
    void testListChangedNotification_TriggersRediscovery() {
        // Given
        SyntheticBackend backend = new SyntheticBackend(SyntheticBackend.echo());
        fixture.backends.put("gamma", backend);
        BackendSession session = fixture.supervisor.addBackend(BackendIdentity.builder()
                .id("gamma").url("synthetic://gamma").notifications(true).build());
        Await.until(() -> session.getState() == BackendState.READY);

        // When
        backend.setOperations(SyntheticBackend.echo(), op("search"));

        // Then
        Await.until(() -> {
            backend.pushListChanged();
            return fixture.registry.lookup(RouteMethod.POST, "/gamma/search").isPresent();
        });
        assertEquals(Set.of("echo", "search"), routedOperations("gamma"));
    }
}
