package com.strata.platform.domain;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

/**
 * A client of the platform. Every non-Root user, schema and row belongs to exactly one tenant.
 *
 * @param contractExpiresAt end of contract; set for natural persons only
 */
public record Tenant(
        UUID id,
        String name,
        TenantType clientType,
        OffsetDateTime contractExpiresAt,
        OffsetDateTime createdAt) {

    public Tenant {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(clientType, "clientType must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
    }
}
