package com.strata.platform.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.strata.platform.domain.DatasetSchema;
import com.strata.security.TenantScope;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * JDBC access to {@code dataset_schemas}. Column lists are stored as a JSON array.
 */
@Repository
public class DatasetSchemaRepository {

    private static final String COLUMNS = "id, tenant_id, name, column_names, row_count, created_at, updated_at";
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final JdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public DatasetSchemaRepository(JdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public Optional<DatasetSchema> findByName(String name) {
        return jdbc.query("SELECT " + COLUMNS + " FROM dataset_schemas WHERE name = ?", this::mapSchema, name)
                .stream()
                .findFirst();
    }

    public Optional<DatasetSchema> findById(UUID id) {
        return jdbc.query("SELECT " + COLUMNS + " FROM dataset_schemas WHERE id = ?", this::mapSchema, id)
                .stream()
                .findFirst();
    }

    public void insert(DatasetSchema schema) {
        jdbc.update(
                "INSERT INTO dataset_schemas (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?)",
                schema.id(),
                schema.tenantId(),
                schema.name(),
                writeColumns(schema.columns()),
                schema.rowCount(),
                schema.createdAt(),
                schema.updatedAt());
    }

    /**
     * Adds {@code rows} to the count of the schema called {@code name}, provided it belongs to
     * {@code tenantId}. The updated row stays locked until the surrounding transaction ends.
     *
     * @return number of schemas updated, 0 or 1
     */
    public int incrementRowCount(UUID tenantId, String name, long rows, OffsetDateTime updatedAt) {
        return jdbc.update(
                "UPDATE dataset_schemas SET row_count = row_count + ?, updated_at = ? WHERE name = ? AND tenant_id = ?",
                rows,
                updatedAt,
                name,
                tenantId);
    }

    public List<DatasetSchema> findRecent(TenantScope scope, int limit) {
        if (scope.isGlobal()) {
            return jdbc.query(
                    "SELECT " + COLUMNS + " FROM dataset_schemas ORDER BY created_at DESC LIMIT ?",
                    this::mapSchema,
                    limit);
        }
        return jdbc.query(
                "SELECT " + COLUMNS + " FROM dataset_schemas WHERE tenant_id = ? ORDER BY created_at DESC LIMIT ?",
                this::mapSchema,
                scope.tenantId(),
                limit);
    }

    public long sumRowCount(TenantScope scope) {
        return scope.isGlobal()
                ? scalar("SELECT COALESCE(SUM(row_count), 0) FROM dataset_schemas")
                : scalar("SELECT COALESCE(SUM(row_count), 0) FROM dataset_schemas WHERE tenant_id = ?", scope.tenantId());
    }

    public long countDistinctNames(TenantScope scope) {
        return scope.isGlobal()
                ? scalar("SELECT COUNT(DISTINCT name) FROM dataset_schemas")
                : scalar("SELECT COUNT(DISTINCT name) FROM dataset_schemas WHERE tenant_id = ?", scope.tenantId());
    }

    private long scalar(String sql, Object... args) {
        Long value = jdbc.queryForObject(sql, Long.class, args);
        return value == null ? 0 : value;
    }

    private String writeColumns(List<String> columns) {
        try {
            return objectMapper.writeValueAsString(columns);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize column list", e);
        }
    }

    private DatasetSchema mapSchema(ResultSet rs, int rowNum) throws SQLException {
        List<String> columns;
        try {
            columns = objectMapper.readValue(rs.getString("column_names"), STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt column list for schema " + rs.getString("id"), e);
        }
        return new DatasetSchema(
                rs.getObject("id", UUID.class),
                rs.getObject("tenant_id", UUID.class),
                rs.getString("name"),
                columns,
                rs.getLong("row_count"),
                rs.getObject("created_at", OffsetDateTime.class),
                rs.getObject("updated_at", OffsetDateTime.class));
    }
}
