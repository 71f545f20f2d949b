package com.strata.platform.application.training;

import com.fasterxml.jackson.databind.JsonNode;
import com.strata.platform.domain.DatasetSchema;
import com.strata.platform.error.PlatformException;
import com.strata.platform.persistence.DatasetSchemaRepository;
import com.strata.security.Action;
import com.strata.security.AuthorizationPolicy;
import com.strata.security.Principal;
import com.strata.security.TenantIsolationEnforcer;
import java.util.UUID;
import org.springframework.stereotype.Service;

/**
 * Forwards training jobs for schemas the caller can see. Write access is required; the role is
 * not checked.
 */
@Service
public class TrainingService {

    private final DatasetSchemaRepository schemas;
    private final TrainingServiceClient client;

    public TrainingService(DatasetSchemaRepository schemas, TrainingServiceClient client) {
        this.schemas = schemas;
        this.client = client;
    }

    public JsonNode train(Principal principal, TrainingRequest request) {
        AuthorizationPolicy.enforce(AuthorizationPolicy.evaluate(principal, Action.INVOKE_TRAINING));

        UUID schemaId = parseSchemaId(request.schemaId());
        DatasetSchema schema = schemas.findById(schemaId)
                .orElseThrow(() -> PlatformException.badRequest("Unknown schema: " + schemaId));
        TenantIsolationEnforcer.enforce(principal, schema.tenantId());

        return client.train(request);
    }

    private static UUID parseSchemaId(String raw) {
        if (raw == null || raw.isBlank()) {
            throw PlatformException.badRequest("schema_id is required");
        }
        try {
            return UUID.fromString(raw.trim());
        } catch (IllegalArgumentException e) {
            throw PlatformException.badRequest("Invalid schema_id: " + raw);
        }
    }
}
