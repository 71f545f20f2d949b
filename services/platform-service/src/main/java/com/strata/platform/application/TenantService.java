package com.strata.platform.application;

import com.strata.platform.domain.Tenant;
import com.strata.platform.domain.TenantOption;
import com.strata.platform.domain.TenantType;
import com.strata.platform.error.PlatformException;
import com.strata.platform.persistence.TenantRepository;
import com.strata.security.Action;
import com.strata.security.AuthorizationPolicy;
import com.strata.security.Principal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class TenantService {

    private static final Logger log = LoggerFactory.getLogger(TenantService.class);

    static final int PUBLIC_SEARCH_LIMIT = 5;
    static final int PROTECTED_SEARCH_LIMIT = 10;

    /**
     * @param contractDurationDays required for natural persons, ignored for companies
     */
    public record CreateTenantCommand(String name, TenantType clientType, Long contractDurationDays) {}

    private final TenantRepository tenants;
    private final Clock clock;

    public TenantService(TenantRepository tenants, Clock clock) {
        this.tenants = tenants;
        this.clock = clock;
    }

    public Tenant create(Principal principal, CreateTenantCommand command) {
        AuthorizationPolicy.enforce(AuthorizationPolicy.evaluate(principal, Action.CREATE_TENANT));

        if (command.name() == null || command.name().isBlank()) {
            throw PlatformException.badRequest("name is required");
        }
        if (command.clientType() == null) {
            throw PlatformException.badRequest("client_type is required");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime expiresAt = null;
        if (command.clientType() == TenantType.NATURAL_PERSON) {
            Long days = command.contractDurationDays();
            if (days == null || days <= 0) {
                throw PlatformException.badRequest("contract_duration_days is required for natural persons");
            }
            expiresAt = now.plusDays(days);
        }

        Tenant tenant = new Tenant(UUID.randomUUID(), command.name().trim(), command.clientType(), expiresAt, now);
        tenants.insert(tenant);
        log.info("Created {} tenant {}", tenant.clientType().value(), tenant.id());
        return tenant;
    }

    /** Unauthenticated lookup used by the login screen. */
    public List<TenantOption> searchPublic(String query) {
        AuthorizationPolicy.enforce(AuthorizationPolicy.evaluate(null, Action.SEARCH_TENANTS_PUBLIC));
        return tenants.searchByName(normalize(query), PUBLIC_SEARCH_LIMIT);
    }

    public List<TenantOption> search(Principal principal, String query) {
        AuthorizationPolicy.enforce(AuthorizationPolicy.evaluate(principal, Action.SEARCH_TENANTS));
        return tenants.searchByName(normalize(query), PROTECTED_SEARCH_LIMIT);
    }

    private static String normalize(String query) {
        return query == null ? "" : query.trim();
    }
}
