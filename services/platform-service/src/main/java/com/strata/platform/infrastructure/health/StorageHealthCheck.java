package com.strata.platform.infrastructure.health;

import com.strata.observability.ComponentHealth;
import com.strata.observability.HealthCheck;
import java.util.concurrent.CompletableFuture;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Round-trips {@code SELECT 1} through the pool.
 */
@Component
public class StorageHealthCheck implements HealthCheck {

    public static final String NAME = "storage";

    private final JdbcTemplate jdbc;

    public StorageHealthCheck(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public CompletableFuture<ComponentHealth> check() {
        return CompletableFuture.supplyAsync(() -> {
            long start = System.nanoTime();
            try {
                jdbc.queryForObject("SELECT 1", Integer.class);
                return ComponentHealth.healthy(NAME, elapsedMs(start));
            } catch (DataAccessException e) {
                return ComponentHealth.unhealthy(NAME, e.getMostSpecificCause().getMessage(), elapsedMs(start));
            }
        });
    }

    static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
