package com.strata.security;

import java.util.UUID;

/**
 * Per-action authorization decisions for the three platform roles.
 *
 * <p>Authentication has already happened when these methods run (the caller holds a verified
 * {@link Principal}). Each evaluation then applies, in order:
 *
 * <ol>
 *   <li>role eligibility for the action
 *   <li>tenant scope resolution, forcing the principal's own tenant where the role requires it
 *   <li>the access-level gate for write actions
 * </ol>
 *
 * <p>The first failing step produces the denial. A decision is never silently narrowed: an action
 * is either allowed as requested (with its scope) or denied with a reason.
 */
public final class AuthorizationPolicy {

    static final String NO_TENANT = "Account is not attached to a tenant";
    static final String READ_ONLY = "Read-only account";

    private AuthorizationPolicy() {
        // utility class
    }

    /**
     * Evaluates an action that does not name a target tenant or role.
     *
     * @param principal the caller; may be null only for {@link Action#SEARCH_TENANTS_PUBLIC}
     * @throws IllegalArgumentException for {@link Action#CREATE_USER} and
     *     {@link Action#UPLOAD_DATASET}, which need their own evaluation methods
     */
    public static PolicyDecision evaluate(Principal principal, Action action) {
        return switch (action) {
            case CREATE_TENANT, SEARCH_TENANTS -> rootOnly(principal, action);
            case SEARCH_TENANTS_PUBLIC -> PolicyDecision.allow(action, TenantScope.global());
            case LIST_USERS -> listUsers(principal);
            case VIEW_STATS, VIEW_ANALYTICS -> ownScope(principal, action);
            case INVOKE_TRAINING -> principal.accessLevel().canWrite()
                    ? ownScope(principal, action)
                    : PolicyDecision.forbid(action, "Write access is required to train models");
            case CREATE_USER, UPLOAD_DATASET -> throw new IllegalArgumentException(
                    action + " requires a target; use the dedicated evaluation method");
        };
    }

    /**
     * Decides whether {@code principal} may create a user with {@code targetRole} in
     * {@code requestedTenantId}. For a CompanyAdmin the requested tenant is ignored and the
     * decision scope is the admin's own tenant.
     *
     * @param requestedTenantId tenant named in the request, may be null
     */
    public static PolicyDecision evaluateUserCreation(
            Principal principal, Role targetRole, UUID requestedTenantId) {
        Action action = Action.CREATE_USER;
        return switch (principal.role()) {
            case ROOT -> PolicyDecision.allow(action, requestedTenantId != null
                    ? TenantScope.of(requestedTenantId) : TenantScope.global());
            case COMPANY_ADMIN -> {
                if (principal.tenantId() == null) {
                    yield PolicyDecision.forbid(action, NO_TENANT);
                }
                if (targetRole == Role.ROOT) {
                    yield PolicyDecision.forbid(action, "Company administrators cannot create root users");
                }
                yield PolicyDecision.allow(action, TenantScope.of(principal.tenantId()));
            }
            case USER -> PolicyDecision.forbid(action, "Not allowed to manage users");
        };
    }

    /**
     * Resolves the destination tenant of an upload. Root must name one explicitly; everyone else
     * always writes into their own tenant, whatever {@code requestedTenantId} says.
     *
     * @param requestedTenantId destination chosen in the request, may be null
     */
    public static PolicyDecision evaluateUpload(Principal principal, UUID requestedTenantId) {
        Action action = Action.UPLOAD_DATASET;
        return switch (principal.role()) {
            case ROOT -> requestedTenantId != null
                    ? PolicyDecision.allow(action, TenantScope.of(requestedTenantId))
                    : PolicyDecision.badRequest(action, "Root must select a destination tenant");
            case COMPANY_ADMIN, USER -> {
                if (principal.tenantId() == null) {
                    yield PolicyDecision.forbid(action, NO_TENANT);
                }
                if (!principal.accessLevel().canWrite()) {
                    yield PolicyDecision.forbid(action, READ_ONLY);
                }
                yield PolicyDecision.allow(action, TenantScope.of(principal.tenantId()));
            }
        };
    }

    /**
     * Pre-check run before the request body is read: fails fast for principals that could never
     * upload, whatever destination they pick.
     */
    public static PolicyDecision evaluateUploadEligibility(Principal principal) {
        if (principal.isRoot()) {
            return PolicyDecision.allow(Action.UPLOAD_DATASET, TenantScope.global());
        }
        return evaluateUpload(principal, null);
    }

    /**
     * Returns the scope of an allowed decision.
     *
     * @throws AccessDeniedException if the decision is a denial
     */
    public static TenantScope enforce(PolicyDecision decision) {
        if (!decision.allowed()) {
            throw new AccessDeniedException(decision);
        }
        return decision.scope();
    }

    private static PolicyDecision rootOnly(Principal principal, Action action) {
        return principal.isRoot()
                ? PolicyDecision.allow(action, TenantScope.global())
                : PolicyDecision.forbid(action, "Only root may perform " + describe(action));
    }

    private static PolicyDecision listUsers(Principal principal) {
        return switch (principal.role()) {
            case ROOT -> PolicyDecision.allow(Action.LIST_USERS, TenantScope.global());
            case COMPANY_ADMIN -> principal.tenantId() != null
                    ? PolicyDecision.allow(Action.LIST_USERS, TenantScope.of(principal.tenantId()))
                    : PolicyDecision.forbid(Action.LIST_USERS, NO_TENANT);
            case USER -> PolicyDecision.forbid(Action.LIST_USERS, "Access denied");
        };
    }

    private static PolicyDecision ownScope(Principal principal, Action action) {
        if (principal.isRoot()) {
            return PolicyDecision.allow(action, TenantScope.global());
        }
        return principal.tenantId() != null
                ? PolicyDecision.allow(action, TenantScope.of(principal.tenantId()))
                : PolicyDecision.forbid(action, NO_TENANT);
    }

    private static String describe(Action action) {
        return action.name().toLowerCase().replace('_', ' ');
    }
}
