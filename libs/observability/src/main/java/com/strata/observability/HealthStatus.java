package com.strata.observability;

/**
 * Health of a single component or of the whole service.
 */
public enum HealthStatus {

    HEALTHY,

    /** Reachable but impaired; requests can still be served. */
    DEGRADED,

    UNHEALTHY
}
