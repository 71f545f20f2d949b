package com.strata.observability;

import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous probe of a single dependency.
 */
@FunctionalInterface
public interface HealthCheck {

    CompletableFuture<ComponentHealth> check();
}
