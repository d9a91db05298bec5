package com.example.mcpgateway.backend;

import com.example.mcpgateway.config.GatewayProperties;
import com.example.mcpgateway.error.GatewayErrorKind;
import com.example.mcpgateway.error.GatewayException;
import com.example.mcpgateway.model.BackendIdentity;
import com.example.mcpgateway.model.BackendState;
import com.example.mcpgateway.model.InvocationContext;
import com.example.mcpgateway.model.OperationDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;

/**
 * Owns one backend connection. Discovery, probing and reconnection run on a
 * dedicated single worker thread, so one backend's state transitions are
 * applied in order. Invocations run concurrently up to the configured limit.
 */
public class BackendSession {

    private static final Logger logger = LoggerFactory.getLogger(BackendSession.class);

    public interface Listener {
        /** Called on the session's worker thread after a discovery that changed the operation set. */
        void onOperationsDiscovered(BackendSession session, List<OperationDescriptor> operations);

        /** Called on the session's worker thread when the backend stops being routable. */
        void onOperationsWithdrawn(BackendSession session);
    }

    private final BackendIdentity identity;
    private final BackendTransport transport;
    private final GatewayProperties properties;
    private final Listener listener;
    private final ReconnectBackoff backoff;
    private final ScheduledExecutorService worker;
    private final Semaphore permits;
    private final int concurrencyLimit;

    private volatile BackendState state = BackendState.DISCONNECTED;
    private volatile List<OperationDescriptor> operations = List.of();
    private volatile boolean discovered;
    private volatile int consecutiveProbeFailures;
    private volatile int reconnectAttempts;
    private volatile String lastError;
    private volatile Instant lastDiscoveryAt;
    private volatile boolean stopped;

    private ScheduledFuture<?> pending;
    private Disposable notifications;

    public BackendSession(BackendIdentity identity, BackendTransport transport,
                          GatewayProperties properties, Listener listener) {
        this(identity, transport, properties, listener, new ReconnectBackoff(properties.getBackoff()));
    }

    BackendSession(BackendIdentity identity, BackendTransport transport, GatewayProperties properties,
                   Listener listener, ReconnectBackoff backoff) {
        this.identity = identity;
        this.transport = transport;
        this.properties = properties;
        this.listener = listener;
        this.backoff = backoff;
        Integer override = identity.getConcurrencyLimit();
        this.concurrencyLimit = Math.max(1, override != null ? override : properties.getConcurrencyLimit());
        this.permits = new Semaphore(concurrencyLimit);
        this.worker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "backend-" + identity.getId());
            t.setDaemon(true);
            return t;
        });
    }

    public String getId() { return identity.getId(); }
    public BackendIdentity getIdentity() { return identity; }
    public BackendState getState() { return state; }
    public List<OperationDescriptor> getOperations() { return operations; }
    public int getConsecutiveProbeFailures() { return consecutiveProbeFailures; }
    public String getLastError() { return lastError; }
    public int getConcurrencyLimit() { return concurrencyLimit; }
    public int getInFlight() { return concurrencyLimit - permits.availablePermits(); }

    public void start() {
        submit(this::connectAndDiscover);
    }

    /** Re-issues discovery, as a periodic timer or a list-changed push would. */
    public void requestRediscovery() {
        submit(this::rediscover);
    }

    public void stop() {
        stopped = true;
        try {
            worker.submit(() -> {
                cancelPending();
                disposeNotifications();
                transition(BackendState.DISCONNECTED);
            }).get(properties.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException | RejectedExecutionException e) {
            logger.warn("Backend {} did not stop cleanly: {}", getId(), e.toString());
        } finally {
            worker.shutdownNow();
            state = BackendState.DISCONNECTED;
            transport.close();
        }
    }

    // ---------------------------------------------------------------
    // Invocation
    // ---------------------------------------------------------------

    public Mono<Map<String, Object>> invoke(InvocationContext ctx) {
        return Mono.defer(() -> {
            if (ctx.isCancelled()) {
                return Mono.empty();
            }
            BackendState current = state;
            if (!current.acceptsInvocations()) {
                GatewayErrorKind kind = current == BackendState.DISCONNECTED
                        ? GatewayErrorKind.BACKEND_UNAVAILABLE
                        : GatewayErrorKind.BACKEND_UNREACHABLE;
                return Mono.error(new GatewayException(kind, getId(), ctx.getOperationName(),
                        "backend is " + current));
            }
            return acquirePermit().flatMap(acquired -> {
                if (!acquired) {
                    return Mono.error(new GatewayException(GatewayErrorKind.BACKEND_OVERLOADED, getId(),
                            ctx.getOperationName(), concurrencyLimit + " invocations already in flight"));
                }
                return transport.invoke(ctx.getOperationName(), ctx.getPayload())
                        .timeout(ctx.remaining())
                        .takeUntilOther(ctx.onCancel())
                        .onErrorMap(e -> translateFailure(ctx, e))
                        .doOnCancel(() -> logger.debug("Invocation {} on backend {} cancelled [{}]",
                                ctx.getOperationName(), getId(), ctx.getCorrelationId()))
                        .doFinally(signal -> permits.release());
            });
        });
    }

    private Mono<Boolean> acquirePermit() {
        if (permits.tryAcquire()) {
            return Mono.just(true);
        }
        long waitMs = properties.getOverloadWait().toMillis();
        if (waitMs <= 0) {
            return Mono.just(false);
        }
        return Mono.fromCallable(() -> {
                    try {
                        return permits.tryAcquire(waitMs, TimeUnit.MILLISECONDS);
                    } catch (InterruptedException e) {
                        // the caller went away while waiting
                        Thread.currentThread().interrupt();
                        return false;
                    }
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Throwable translateFailure(InvocationContext ctx, Throwable e) {
        String op = ctx.getOperationName();
        if (e instanceof GatewayException) {
            return e;
        }
        if (e instanceof TimeoutException) {
            return new GatewayException(GatewayErrorKind.INVOCATION_TIMEOUT, getId(), op, null,
                    "deadline exceeded", e);
        }
        if (e instanceof BackendBusinessException business) {
            return GatewayException.business(getId(), op, business.getErrorName(), business.getMessage(), e);
        }
        markDegraded(e);
        return new GatewayException(GatewayErrorKind.BACKEND_UNAVAILABLE, getId(), op, null,
                e.getMessage(), e);
    }

    // ---------------------------------------------------------------
    // State machine (worker thread only)
    // ---------------------------------------------------------------

    void connectAndDiscover() {
        if (stopped) return;
        transition(BackendState.CONNECTING);
        try {
            transport.initialize().timeout(properties.getConnectTimeout()).block();
        } catch (RuntimeException e) {
            lastError = "BackendUnreachable: " + describe(e);
            logger.warn("Backend {} unreachable at {}: {}", getId(), identity.getUrl(), describe(e));
            enterReconnecting();
            return;
        }
        reconnectAttempts = 0;
        consecutiveProbeFailures = 0;
        transition(BackendState.DISCOVERING);
        if (!discover()) {
            enterReconnecting();
            return;
        }
        subscribeNotifications();
        schedule(this::rediscover, properties.getRediscoveryInterval());
    }

    void rediscover() {
        if (stopped || state != BackendState.READY) return;
        if (!discover()) {
            enterDegraded();
            return;
        }
        schedule(this::rediscover, properties.getRediscoveryInterval());
    }

    /**
     * Returns false only on transport failure. Malformed or empty listings
     * leave the session ready with no operations.
     */
    private boolean discover() {
        List<OperationDescriptor> fetched;
        try {
            fetched = transport.listOperations().timeout(properties.getDiscoveryTimeout()).block();
        } catch (BackendBusinessException e) {
            logger.warn("Backend {} rejected discovery, exposing no operations: {}", getId(), e.getMessage());
            fetched = List.of();
        } catch (RuntimeException e) {
            lastError = "Discovery failed: " + describe(e);
            logger.warn("Discovery on backend {} failed: {}", getId(), describe(e));
            return false;
        }
        if (fetched == null) fetched = List.of();
        lastDiscoveryAt = Instant.now();

        List<OperationDescriptor> snapshot = List.copyOf(fetched);
        if (!discovered || !snapshot.equals(operations)) {
            logger.info("Backend {} exposes {} operation(s)", getId(), snapshot.size());
            operations = snapshot;
            discovered = true;
            listener.onOperationsDiscovered(this, snapshot);
        } else {
            logger.debug("Backend {} capability set unchanged", getId());
        }
        transition(BackendState.READY);
        return true;
    }

    void markDegraded(Throwable cause) {
        lastError = describe(cause);
        submit(this::enterDegraded);
    }

    private void enterDegraded() {
        if (stopped || state != BackendState.READY) return;
        consecutiveProbeFailures = 0;
        transition(BackendState.DEGRADED);
        schedule(this::probe, properties.getProbeInterval());
    }

    void probe() {
        if (stopped || state != BackendState.DEGRADED) return;
        try {
            transport.ping().timeout(properties.getConnectTimeout()).block();
        } catch (BackendBusinessException e) {
            // an error reply still proves the backend is answering
            logger.debug("Backend {} answered ping with {}: {}", getId(), e.getErrorName(), e.getMessage());
        } catch (RuntimeException e) {
            int failures = ++consecutiveProbeFailures;
            lastError = "Probe failed: " + describe(e);
            logger.warn("Probe {} of {} for backend {} failed: {}",
                    failures, properties.getProbeFailureThreshold(), getId(), describe(e));
            if (failures >= properties.getProbeFailureThreshold()) {
                enterReconnecting();
            } else {
                schedule(this::probe, properties.getProbeInterval());
            }
            return;
        }
        consecutiveProbeFailures = 0;
        logger.info("Backend {} recovered", getId());
        transition(BackendState.READY);
        schedule(this::rediscover, properties.getRediscoveryInterval());
    }

    private void enterReconnecting() {
        if (stopped) return;
        transition(BackendState.RECONNECTING);
        disposeNotifications();
        if (discovered) {
            operations = List.of();
            discovered = false;
            listener.onOperationsWithdrawn(this);
        }
        Duration delay = backoff.delay(reconnectAttempts++);
        logger.info("Reconnecting to backend {} in {} ms (attempt {})", getId(), delay.toMillis(), reconnectAttempts);
        schedule(this::connectAndDiscover, delay);
    }

    private void subscribeNotifications() {
        if (!identity.isNotifications()) return;
        disposeNotifications();
        notifications = transport.capabilityChanges().subscribe(
                change -> {
                    logger.debug("Backend {} pushed {}", getId(), change);
                    requestRediscovery();
                },
                error -> logger.debug("Notification stream of backend {} ended: {}", getId(), error.getMessage()));
    }

    private void disposeNotifications() {
        if (notifications != null) {
            notifications.dispose();
            notifications = null;
        }
    }

    private void transition(BackendState next) {
        BackendState previous = state;
        if (previous == next) return;
        state = next;
        logger.info("Backend {}: {} -> {}", getId(), previous, next);
    }

    private void schedule(Runnable task, Duration delay) {
        cancelPending();
        if (stopped) return;
        pending = worker.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void cancelPending() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }

    private void submit(Runnable task) {
        if (stopped) return;
        try {
            worker.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    logger.error("Backend {} state machine step failed", getId(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            logger.debug("Backend {} already shut down", getId());
        }
    }

    public Map<String, Object> describeHealth() {
        Map<String, Object> health = new HashMap<>();
        health.put("state", state.name());
        health.put("url", identity.getUrl());
        health.put("operations", operations.size());
        health.put("inFlight", getInFlight());
        health.put("concurrencyLimit", concurrencyLimit);
        health.put("consecutiveProbeFailures", consecutiveProbeFailures);
        if (lastError != null) health.put("lastError", lastError);
        if (lastDiscoveryAt != null) health.put("lastDiscoveryAt", lastDiscoveryAt.toString());
        return health;
    }

    private static String describe(Throwable e) {
        // block() wraps checked exceptions such as TimeoutException
        Throwable root = Exceptions.unwrap(e);
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
