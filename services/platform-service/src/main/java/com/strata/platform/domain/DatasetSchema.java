package com.strata.platform.domain;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Catalog entry of an ingested dataset. {@code rowCount} accumulates across merged uploads.
 */
public record DatasetSchema(
        UUID id,
        UUID tenantId,
        String name,
        List<String> columns,
        long rowCount,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt) {

    public DatasetSchema {
        columns = columns == null ? List.of() : List.copyOf(columns);
    }
}
