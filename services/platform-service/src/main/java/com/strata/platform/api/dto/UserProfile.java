package com.strata.platform.api.dto;

import com.strata.platform.domain.UserAccount;
import java.util.UUID;

/**
 * Account as returned to clients; never carries the credential hash.
 */
public record UserProfile(UUID id, String email, String role, UUID clientId, String status, String accessLevel) {

    public static UserProfile from(UserAccount user) {
        return new UserProfile(
                user.id(),
                user.email(),
                user.role().value(),
                user.tenantId(),
                user.status().value(),
                user.accessLevel().value());
    }
}
