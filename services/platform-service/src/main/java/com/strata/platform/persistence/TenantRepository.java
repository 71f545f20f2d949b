package com.strata.platform.persistence;

import com.strata.platform.domain.Tenant;
import com.strata.platform.domain.TenantOption;
import com.strata.platform.domain.TenantType;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class TenantRepository {

    private final JdbcTemplate jdbc;

    public TenantRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void insert(Tenant tenant) {
        jdbc.update(
                "INSERT INTO tenants (id, name, client_type, contract_expires_at, created_at) VALUES (?, ?, ?, ?, ?)",
                tenant.id(),
                tenant.name(),
                tenant.clientType().value(),
                tenant.contractExpiresAt(),
                tenant.createdAt());
    }

    public Optional<Tenant> findById(UUID id) {
        return jdbc.query(
                        "SELECT id, name, client_type, contract_expires_at, created_at FROM tenants WHERE id = ?",
                        TenantRepository::mapTenant,
                        id)
                .stream()
                .findFirst();
    }

    public boolean exists(UUID id) {
        Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM tenants WHERE id = ?", Integer.class, id);
        return count != null && count > 0;
    }

    /**
     * Case-insensitive substring match on the tenant name.
     */
    public List<TenantOption> searchByName(String query, int limit) {
        return jdbc.query(
                "SELECT id, name FROM tenants WHERE name ILIKE ? ORDER BY name LIMIT ?",
                (rs, i) -> new TenantOption(rs.getObject("id", UUID.class), rs.getString("name")),
                "%" + query + "%",
                limit);
    }

    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM tenants", Long.class);
        return count == null ? 0 : count;
    }

    private static Tenant mapTenant(ResultSet rs, int rowNum) throws SQLException {
        String type = rs.getString("client_type");
        return new Tenant(
                rs.getObject("id", UUID.class),
                rs.getString("name"),
                TenantType.fromString(type)
                        .orElseThrow(() -> new IllegalStateException("Unknown client_type in storage: " + type)),
                rs.getObject("contract_expires_at", OffsetDateTime.class),
                rs.getObject("created_at", OffsetDateTime.class));
    }
}
