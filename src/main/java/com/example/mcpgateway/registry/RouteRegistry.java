package com.example.mcpgateway.registry;

import com.example.mcpgateway.backend.BackendSession;
import com.example.mcpgateway.model.RouteDescriptor;
import com.example.mcpgateway.model.RouteKey;
import com.example.mcpgateway.model.RouteMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Route table backed by an immutable {@link Snapshot}. Every mutation builds a
 * new snapshot and publishes it with a single reference swap, so readers see
 * either all of a backend's routes or none of them.
 */
@Component
public class RouteRegistry {

    private static final Logger logger = LoggerFactory.getLogger(RouteRegistry.class);

    private final AtomicReference<Snapshot> current = new AtomicReference<>(Snapshot.EMPTY);

    public Snapshot snapshot() {
        return current.get();
    }

    public Optional<RouteEntry> lookup(RouteMethod method, String path) {
        if (method == null || path == null) return Optional.empty();
        return Optional.ofNullable(current.get().byRoute.get(new RouteKey(method, path)));
    }

    /**
     * Replaces the backend's route set in one step. Returns the number of
     * routes registered.
     */
    public int replaceBackend(BackendSession session, List<RouteDescriptor> routes) {
        Snapshot next = current.updateAndGet(s -> s.withBackend(session, routes));
        int registered = next.routesOf(session.getId()).size();
        logger.info("Registered {} route(s) for backend {}", registered, session.getId());
        return registered;
    }

    public void removeBackend(String backendId) {
        Snapshot before = current.getAndUpdate(s -> s.withoutBackend(backendId));
        int removed = before.routesOf(backendId).size();
        if (removed > 0) {
            logger.info("Deregistered {} route(s) for backend {}", removed, backendId);
        }
    }

    public static final class Snapshot {

        static final Snapshot EMPTY = new Snapshot(Map.of(), Map.of());

        private final Map<String, List<RouteEntry>> byBackend;
        private final Map<RouteKey, RouteEntry> byRoute;

        private Snapshot(Map<String, List<RouteEntry>> byBackend, Map<RouteKey, RouteEntry> byRoute) {
            this.byBackend = byBackend;
            this.byRoute = byRoute;
        }

        public List<RouteEntry> routesOf(String backendId) {
            return byBackend.getOrDefault(backendId, List.of());
        }

        public Set<String> backendIds() {
            return byBackend.keySet();
        }

        /** All routes, ordered by backend id then discovery order. */
        public List<RouteEntry> routes() {
            List<RouteEntry> all = new ArrayList<>(byRoute.size());
            byBackend.values().forEach(all::addAll);
            return all;
        }

        public int size() {
            return byRoute.size();
        }

        Snapshot withBackend(BackendSession session, List<RouteDescriptor> routes) {
            String backendId = session.getId();
            Map<String, List<RouteEntry>> backends = new TreeMap<>(byBackend);
            Map<RouteKey, RouteEntry> table = new HashMap<>(byRoute);
            for (RouteEntry old : byBackend.getOrDefault(backendId, List.of())) {
                table.remove(old.getRoute().key());
            }

            Set<String> paths = new HashSet<>();
            List<RouteEntry> entries = new ArrayList<>(routes.size());
            for (RouteDescriptor route : routes) {
                if (!paths.add(route.getPath())) {
                    logger.warn("Backend {} reported operation {} more than once, keeping the first",
                            backendId, route.getOperationName());
                    continue;
                }
                if (ownedByOther(table, route, backendId)) {
                    logger.warn("Path {} is already owned by another backend, skipping {}",
                            route.getPath(), route.getOperationName());
                    continue;
                }
                RouteEntry entry = new RouteEntry(route, session);
                entries.add(entry);
                table.put(route.key(), entry);
            }
            backends.put(backendId, List.copyOf(entries));
            return new Snapshot(Collections.unmodifiableMap(backends), Collections.unmodifiableMap(table));
        }

        Snapshot withoutBackend(String backendId) {
            if (!byBackend.containsKey(backendId)) return this;
            Map<String, List<RouteEntry>> backends = new TreeMap<>(byBackend);
            Map<RouteKey, RouteEntry> table = new HashMap<>(byRoute);
            for (RouteEntry old : backends.remove(backendId)) {
                table.remove(old.getRoute().key());
            }
            return new Snapshot(Collections.unmodifiableMap(backends), Collections.unmodifiableMap(table));
        }

        private static boolean ownedByOther(Map<RouteKey, RouteEntry> table, RouteDescriptor route, String backendId) {
            for (RouteMethod method : RouteMethod.values()) {
                RouteEntry existing = table.get(new RouteKey(method, route.getPath()));
                if (existing != null && !existing.getRoute().getBackendId().equals(backendId)) return true;
            }
            return false;
        }
    }
}
