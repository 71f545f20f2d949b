package com.strata.platform.domain;

import java.util.UUID;

/**
 * Tenant as shown in search results: id and display name only.
 */
public record TenantOption(UUID id, String name) {}
