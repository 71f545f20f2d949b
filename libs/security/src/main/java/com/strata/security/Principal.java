package com.strata.security;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * The authenticated identity of a request, re-derived from the session token on every call.
 *
 * <p>A principal is only ever built from verified token claims (or at login, from the stored
 * account), so a non-Root principal cannot change its tenant during a session.
 *
 * @param id          user account id (token {@code sub})
 * @param role        platform role
 * @param tenantId    owning tenant; null for Root
 * @param accessLevel read-only or read-write
 */
public record Principal(UUID id, Role role, UUID tenantId, AccessLevel accessLevel) {

    public Principal {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(accessLevel, "accessLevel must not be null");
    }

    public boolean isRoot() {
        return role == Role.ROOT;
    }

    public Optional<UUID> tenant() {
        return Optional.ofNullable(tenantId);
    }
}
