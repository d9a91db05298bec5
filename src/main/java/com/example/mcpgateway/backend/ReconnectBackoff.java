package com.example.mcpgateway.backend;

import com.example.mcpgateway.config.GatewayProperties;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Capped exponential backoff with symmetric jitter.
 */
public class ReconnectBackoff {

    private final Duration initial;
    private final Duration max;
    private final double jitter;
    private final DoubleSupplier random;

    public ReconnectBackoff(GatewayProperties.Backoff settings) {
        this(settings.getInitial(), settings.getMax(), settings.getJitter(),
                () -> ThreadLocalRandom.current().nextDouble());
    }

    ReconnectBackoff(Duration initial, Duration max, double jitter, DoubleSupplier random) {
        this.initial = initial;
        this.max = max.compareTo(initial) < 0 ? initial : max;
        this.jitter = Math.max(0.0, Math.min(jitter, 1.0));
        this.random = random;
    }

    public Duration delay(int attempt) {
        long base = initial.toMillis();
        long cap = max.toMillis();
        int shift = Math.min(Math.max(attempt, 0), 30);
        long exp = base << shift;
        if (exp <= 0 || exp > cap) exp = cap;

        double factor = 1.0 + jitter * (2.0 * random.getAsDouble() - 1.0);
        long jittered = Math.round(exp * factor);
        return Duration.ofMillis(Math.max(0L, Math.min(jittered, cap)));
    }
}
