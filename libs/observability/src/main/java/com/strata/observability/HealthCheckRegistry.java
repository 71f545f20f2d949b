package com.strata.observability;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs all registered {@link HealthCheck}s concurrently and folds them into one
 * {@link HealthResult}. A check that exceeds the timeout or completes exceptionally counts as
 * {@link HealthStatus#UNHEALTHY}.
 */
public final class HealthCheckRegistry {

    public static final long DEFAULT_TIMEOUT_MS = 5000;

    private final Map<String, HealthCheck> checks = new ConcurrentHashMap<>();
    private final long timeoutMs;

    public HealthCheckRegistry() {
        this(DEFAULT_TIMEOUT_MS);
    }

    public HealthCheckRegistry(long timeoutMs) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
        this.timeoutMs = timeoutMs;
    }

    /**
     * Registers a check, replacing any previous check with the same name.
     */
    public void register(String name, HealthCheck check) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        checks.put(name, check);
    }

    public HealthResult checkAll() {
        Map<String, CompletableFuture<ComponentHealth>> pending = new LinkedHashMap<>();
        checks.forEach((name, check) -> pending.put(name, check.check()));

        Map<String, ComponentHealth> results = new LinkedHashMap<>();
        HealthStatus overall = HealthStatus.HEALTHY;
        for (Map.Entry<String, CompletableFuture<ComponentHealth>> entry : pending.entrySet()) {
            ComponentHealth result;
            try {
                result = entry.getValue().orTimeout(timeoutMs, TimeUnit.MILLISECONDS).join();
            } catch (RuntimeException e) {
                result = ComponentHealth.unhealthy(
                        entry.getKey(), "Timeout or error: " + e.getMessage(), timeoutMs);
            }
            results.put(entry.getKey(), result);
            overall = worst(overall, result.status());
        }
        return new HealthResult(overall, results, Instant.now());
    }

    private static HealthStatus worst(HealthStatus a, HealthStatus b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }
}
