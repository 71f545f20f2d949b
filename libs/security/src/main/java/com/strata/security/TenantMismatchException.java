package com.strata.security;

import java.util.UUID;

/**
 * A principal tried to touch a resource owned by a tenant outside its scope.
 */
public class TenantMismatchException extends RuntimeException {

    private final UUID principalTenantId;
    private final UUID resourceTenantId;

    public TenantMismatchException(UUID principalTenantId, UUID resourceTenantId) {
        super("Tenant mismatch: tenant '%s' cannot access resource of tenant '%s'"
                .formatted(principalTenantId, resourceTenantId));
        this.principalTenantId = principalTenantId;
        this.resourceTenantId = resourceTenantId;
    }

    public UUID principalTenantId() {
        return principalTenantId;
    }

    public UUID resourceTenantId() {
        return resourceTenantId;
    }
}
