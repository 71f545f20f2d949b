package com.strata.platform.api.dto;

import com.strata.security.Principal;
import java.util.UUID;

/**
 * The caller as reconstructed from its session token.
 */
public record MeResponse(UUID id, String role, UUID clientId, String accessLevel) {

    public static MeResponse from(Principal principal) {
        return new MeResponse(
                principal.id(),
                principal.role().value(),
                principal.tenantId(),
                principal.accessLevel().value());
    }
}
