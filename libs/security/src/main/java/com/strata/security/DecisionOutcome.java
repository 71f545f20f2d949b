package com.strata.security;

/**
 * How a policy evaluation ended. Denials carry the kind of failure the caller reports.
 */
public enum DecisionOutcome {
    ALLOW,
    /** Authenticated but not permitted. */
    FORBIDDEN,
    /** Permitted in principle, but the request lacks a required choice. */
    BAD_REQUEST
}
