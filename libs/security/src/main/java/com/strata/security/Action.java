package com.strata.security;

/**
 * Operations gated by {@link AuthorizationPolicy}.
 */
public enum Action {
    CREATE_TENANT,
    CREATE_USER,
    LIST_USERS,
    SEARCH_TENANTS,
    SEARCH_TENANTS_PUBLIC,
    UPLOAD_DATASET,
    VIEW_STATS,
    VIEW_ANALYTICS,
    INVOKE_TRAINING
}
