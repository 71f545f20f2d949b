package com.strata.platform.application;

import com.strata.platform.application.ingest.SchemaRegistry;
import com.strata.platform.domain.DatasetSchema;
import com.strata.security.Action;
import com.strata.security.AuthorizationPolicy;
import com.strata.security.Principal;
import com.strata.security.TenantScope;
import java.util.List;
import org.springframework.stereotype.Service;

@Service
public class AnalyticsService {

    /** Ten most recent schemas in scope and the total rows ingested there. */
    public record Analytics(List<DatasetSchema> recentUploads, long totalRows) {}

    private final SchemaRegistry schemaRegistry;

    public AnalyticsService(SchemaRegistry schemaRegistry) {
        this.schemaRegistry = schemaRegistry;
    }

    public Analytics analytics(Principal principal) {
        TenantScope scope = AuthorizationPolicy.enforce(AuthorizationPolicy.evaluate(principal, Action.VIEW_ANALYTICS));
        return new Analytics(schemaRegistry.list(scope), schemaRegistry.aggregateRowCount(scope));
    }
}
