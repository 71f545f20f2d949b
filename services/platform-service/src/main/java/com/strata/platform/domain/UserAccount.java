package com.strata.platform.domain;

import com.strata.security.AccessLevel;
import com.strata.security.Principal;
import com.strata.security.Role;
import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

/**
 * Stored user account. {@code tenantId} is null only for Root.
 */
public record UserAccount(
        UUID id,
        UUID tenantId,
        String email,
        String credentialHash,
        Role role,
        AccountStatus status,
        AccessLevel accessLevel,
        OffsetDateTime createdAt) {

    public UserAccount {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(email, "email must not be null");
        Objects.requireNonNull(credentialHash, "credentialHash must not be null");
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(accessLevel, "accessLevel must not be null");
    }

    public boolean isDisabled() {
        return status == AccountStatus.DISABLED;
    }

    public Principal toPrincipal() {
        return new Principal(id, role, tenantId, accessLevel);
    }
}
