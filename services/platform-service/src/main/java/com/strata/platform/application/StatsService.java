package com.strata.platform.application;

import com.strata.platform.application.ingest.SchemaRegistry;
import com.strata.platform.persistence.TenantRepository;
import com.strata.platform.persistence.UserRepository;
import com.strata.security.Action;
import com.strata.security.AuthorizationPolicy;
import com.strata.security.Principal;
import com.strata.security.Role;
import com.strata.security.TenantScope;
import org.springframework.stereotype.Service;

/**
 * Dashboard counters. Root sees the whole platform; a company administrator sees its tenant;
 * a plain user sees itself plus its tenant's datasets.
 */
@Service
public class StatsService {

    public record DashboardStats(long totalClients, long totalUsers, long activeUsers, long totalDatasets) {}

    private final TenantRepository tenants;
    private final UserRepository users;
    private final SchemaRegistry schemaRegistry;

    public StatsService(TenantRepository tenants, UserRepository users, SchemaRegistry schemaRegistry) {
        this.tenants = tenants;
        this.users = users;
        this.schemaRegistry = schemaRegistry;
    }

    public DashboardStats stats(Principal principal) {
        TenantScope scope = AuthorizationPolicy.enforce(AuthorizationPolicy.evaluate(principal, Action.VIEW_STATS));
        long datasets = schemaRegistry.countDistinctNames(scope);

        if (scope.isGlobal()) {
            return new DashboardStats(tenants.count(), users.count(scope), users.countActive(scope), datasets);
        }
        if (principal.role() == Role.COMPANY_ADMIN) {
            return new DashboardStats(1, users.count(scope), users.countActive(scope), datasets);
        }
        return new DashboardStats(1, 1, 1, datasets);
    }
}
