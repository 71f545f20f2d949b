package com.strata.platform.persistence;

import com.strata.platform.domain.AccountStatus;
import com.strata.platform.domain.UserAccount;
import com.strata.security.AccessLevel;
import com.strata.security.Role;
import com.strata.security.TenantScope;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class UserRepository {

    private static final String COLUMNS =
            "id, tenant_id, email, credential_hash, role, status, access_level, created_at";

    private final JdbcTemplate jdbc;

    public UserRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * @throws org.springframework.dao.DuplicateKeyException if the email is already registered
     */
    public void insert(UserAccount user) {
        jdbc.update(
                "INSERT INTO users (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                user.id(),
                user.tenantId(),
                user.email(),
                user.credentialHash(),
                user.role().value(),
                user.status().value(),
                user.accessLevel().value(),
                user.createdAt());
    }

    public Optional<UserAccount> findByEmail(String email) {
        return jdbc.query("SELECT " + COLUMNS + " FROM users WHERE email = ?", UserRepository::mapUser, email)
                .stream()
                .findFirst();
    }

    /** Newest accounts across all tenants. */
    public List<UserAccount> findRecent(int limit) {
        return jdbc.query(
                "SELECT " + COLUMNS + " FROM users ORDER BY created_at DESC LIMIT ?", UserRepository::mapUser, limit);
    }

    public List<UserAccount> findByTenant(UUID tenantId) {
        return jdbc.query(
                "SELECT " + COLUMNS + " FROM users WHERE tenant_id = ? ORDER BY created_at DESC",
                UserRepository::mapUser,
                tenantId);
    }

    public long count(TenantScope scope) {
        return scope.isGlobal()
                ? scalar("SELECT COUNT(*) FROM users")
                : scalar("SELECT COUNT(*) FROM users WHERE tenant_id = ?", scope.tenantId());
    }

    public long countActive(TenantScope scope) {
        String active = AccountStatus.ACTIVE.value();
        return scope.isGlobal()
                ? scalar("SELECT COUNT(*) FROM users WHERE status = ?", active)
                : scalar("SELECT COUNT(*) FROM users WHERE tenant_id = ? AND status = ?", scope.tenantId(), active);
    }

    private long scalar(String sql, Object... args) {
        Long value = jdbc.queryForObject(sql, Long.class, args);
        return value == null ? 0 : value;
    }

    private static UserAccount mapUser(ResultSet rs, int rowNum) throws SQLException {
        String role = rs.getString("role");
        String status = rs.getString("status");
        String accessLevel = rs.getString("access_level");
        return new UserAccount(
                rs.getObject("id", UUID.class),
                rs.getObject("tenant_id", UUID.class),
                rs.getString("email"),
                rs.getString("credential_hash"),
                Role.fromString(role)
                        .orElseThrow(() -> new IllegalStateException("Unknown role in storage: " + role)),
                AccountStatus.fromString(status)
                        .orElseThrow(() -> new IllegalStateException("Unknown status in storage: " + status)),
                AccessLevel.fromString(accessLevel)
                        .orElseThrow(() -> new IllegalStateException("Unknown access level in storage: " + accessLevel)),
                rs.getObject("created_at", OffsetDateTime.class));
    }
}
