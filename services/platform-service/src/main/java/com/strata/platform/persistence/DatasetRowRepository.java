package com.strata.platform.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * JDBC access to {@code dataset_rows}. Each row is stored as a JSON object.
 */
@Repository
public class DatasetRowRepository {

    private final JdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public DatasetRowRepository(JdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public void insert(UUID schemaId, UUID tenantId, Map<String, String> row) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(row);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize row", e);
        }
        jdbc.update(
                "INSERT INTO dataset_rows (id, schema_id, tenant_id, payload) VALUES (?, ?, ?, ?)",
                UUID.randomUUID(),
                schemaId,
                tenantId,
                payload);
    }

    public long countBySchema(UUID schemaId) {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM dataset_rows WHERE schema_id = ?", Long.class, schemaId);
        return count == null ? 0 : count;
    }

    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM dataset_rows", Long.class);
        return count == null ? 0 : count;
    }
}
