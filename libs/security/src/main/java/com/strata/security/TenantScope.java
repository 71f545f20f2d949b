package com.strata.security;

import java.util.Objects;
import java.util.UUID;

/**
 * The set of tenants an allowed action may touch: either every tenant (Root reads) or exactly one.
 *
 * @param tenantId the single tenant, or null for the global scope
 */
public record TenantScope(UUID tenantId) {

    private static final TenantScope GLOBAL = new TenantScope(null);

    public static TenantScope global() {
        return GLOBAL;
    }

    public static TenantScope of(UUID tenantId) {
        return new TenantScope(Objects.requireNonNull(tenantId, "tenantId must not be null"));
    }

    public boolean isGlobal() {
        return tenantId == null;
    }

    /** Whether a resource owned by {@code resourceTenantId} is inside this scope. */
    public boolean covers(UUID resourceTenantId) {
        return isGlobal() || tenantId.equals(resourceTenantId);
    }
}
