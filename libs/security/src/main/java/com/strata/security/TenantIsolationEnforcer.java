package com.strata.security;

import java.util.UUID;

/**
 * Checks that a resource fetched by id belongs to a tenant the caller may see. Root passes for
 * every tenant; everyone else only for their own.
 */
public final class TenantIsolationEnforcer {

    private TenantIsolationEnforcer() {
        // utility class
    }

    /**
     * @throws TenantMismatchException if the resource lies outside the principal's tenant
     */
    public static void enforce(Principal principal, UUID resourceTenantId) {
        if (principal.isRoot()) {
            return;
        }
        if (principal.tenantId() == null || !principal.tenantId().equals(resourceTenantId)) {
            throw new TenantMismatchException(principal.tenantId(), resourceTenantId);
        }
    }
}
