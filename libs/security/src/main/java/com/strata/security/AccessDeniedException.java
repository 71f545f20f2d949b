package com.strata.security;

/**
 * Thrown by {@link AuthorizationPolicy#enforce(PolicyDecision)} for a denied decision.
 */
public class AccessDeniedException extends RuntimeException {

    private final PolicyDecision decision;

    public AccessDeniedException(PolicyDecision decision) {
        super(decision.reason());
        this.decision = decision;
    }

    public PolicyDecision decision() {
        return decision;
    }

    public DecisionOutcome outcome() {
        return decision.outcome();
    }
}
