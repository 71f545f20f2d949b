package com.strata.platform.application;

import com.strata.platform.domain.AccountStatus;
import com.strata.platform.domain.UserAccount;
import com.strata.platform.error.PlatformException;
import com.strata.platform.persistence.TenantRepository;
import com.strata.platform.persistence.UserRepository;
import com.strata.security.AccessLevel;
import com.strata.security.Action;
import com.strata.security.AuthorizationPolicy;
import com.strata.security.Principal;
import com.strata.security.Role;
import com.strata.security.TenantScope;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

/**
 * Account creation and listing.
 *
 * <p>Company administrators always create into their own tenant, whatever tenant the request
 * names.
 */
@Service
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    static final int GLOBAL_LIST_LIMIT = 50;
    static final String EMAIL_TAKEN = "Email already registered";

    /**
     * Raw request values; role, status and access level use their wire names.
     */
    public record CreateUserCommand(
            String email, String password, String role, UUID clientId, String status, String accessLevel) {}

    private final UserRepository users;
    private final TenantRepository tenants;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    public UserService(UserRepository users, TenantRepository tenants, PasswordEncoder passwordEncoder, Clock clock) {
        this.users = users;
        this.tenants = tenants;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
    }

    public UserAccount create(Principal principal, CreateUserCommand command) {
        Role role = Role.fromString(command.role())
                .orElseThrow(() -> PlatformException.badRequest("Unknown role: " + command.role()));

        TenantScope scope = AuthorizationPolicy.enforce(
                AuthorizationPolicy.evaluateUserCreation(principal, role, command.clientId()));

        AccountStatus status = command.status() == null
                ? AccountStatus.ACTIVE
                : AccountStatus.fromString(command.status())
                        .orElseThrow(() -> PlatformException.badRequest("Unknown status: " + command.status()));
        AccessLevel accessLevel = command.accessLevel() == null
                ? AccessLevel.READ_WRITE
                : AccessLevel.fromString(command.accessLevel())
                        .orElseThrow(() -> PlatformException.badRequest("Unknown access_level: " + command.accessLevel()));

        UUID tenantId = resolveTenant(role, scope);

        UserAccount user = new UserAccount(
                UUID.randomUUID(),
                tenantId,
                command.email().trim(),
                passwordEncoder.encode(command.password()),
                role,
                status,
                accessLevel,
                OffsetDateTime.now(clock));
        try {
            users.insert(user);
        } catch (DuplicateKeyException e) {
            throw PlatformException.badRequest(EMAIL_TAKEN);
        }
        log.info("User {} created account {} ({}) in tenant {}", principal.id(), user.id(), role.value(), tenantId);
        return user;
    }

    public List<UserAccount> list(Principal principal) {
        TenantScope scope = AuthorizationPolicy.enforce(AuthorizationPolicy.evaluate(principal, Action.LIST_USERS));
        return scope.isGlobal() ? users.findRecent(GLOBAL_LIST_LIMIT) : users.findByTenant(scope.tenantId());
    }

    /**
     * Root accounts never belong to a tenant; every other account must belong to an existing one.
     */
    private UUID resolveTenant(Role role, TenantScope scope) {
        if (role == Role.ROOT) {
            return null;
        }
        if (scope.isGlobal()) {
            throw PlatformException.badRequest("client_id is required for " + role.value() + " accounts");
        }
        if (!tenants.exists(scope.tenantId())) {
            throw PlatformException.badRequest("Unknown client: " + scope.tenantId());
        }
        return scope.tenantId();
    }
}
