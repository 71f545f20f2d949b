package com.strata.security;

/**
 * Result of one policy evaluation.
 *
 * <p>An allowed decision carries the {@link TenantScope} the action is bound to; for user creation
 * and uploads that scope is the forced destination tenant. A denied decision carries a reason that
 * is safe to show to the client.
 *
 * @param action  the evaluated action
 * @param outcome allow, or the kind of denial
 * @param reason  human-readable denial reason, null when allowed
 * @param scope   tenant binding of an allowed action, null when denied
 */
public record PolicyDecision(Action action, DecisionOutcome outcome, String reason, TenantScope scope) {

    public static PolicyDecision allow(Action action, TenantScope scope) {
        return new PolicyDecision(action, DecisionOutcome.ALLOW, null, scope);
    }

    public static PolicyDecision forbid(Action action, String reason) {
        return new PolicyDecision(action, DecisionOutcome.FORBIDDEN, reason, null);
    }

    public static PolicyDecision badRequest(Action action, String reason) {
        return new PolicyDecision(action, DecisionOutcome.BAD_REQUEST, reason, null);
    }

    public boolean allowed() {
        return outcome == DecisionOutcome.ALLOW;
    }
}
