package com.strata.database;

import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the relational store.
 *
 * <pre>{@code
 * strata:
 *   storage:
 *     url: jdbc:postgresql://localhost:5432/strata
 *     username: strata
 *     password: strata_dev_password
 *     max-pool-size: 5
 *     retry-backoff: 2s
 *     migration-locations: classpath:db/migration
 * }</pre>
 *
 * @param url                JDBC connection URL
 * @param username           database user
 * @param password           database password, may be empty
 * @param maxPoolSize        upper bound of pooled connections; requests block when exhausted
 * @param retryBackoff       fixed wait between startup connection attempts
 * @param connectionTimeout  how long a single checkout waits for a free connection
 * @param migrationLocations Flyway migration locations
 */
@Validated
@ConfigurationProperties(prefix = "strata.storage")
public record StorageProperties(
        @NotBlank String url,
        @NotBlank String username,
        String password,
        Integer maxPoolSize,
        Duration retryBackoff,
        Duration connectionTimeout,
        String migrationLocations) {

    public static final int DEFAULT_MAX_POOL_SIZE = 5;
    public static final Duration DEFAULT_RETRY_BACKOFF = Duration.ofSeconds(2);
    public static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(30);
    public static final String DEFAULT_MIGRATION_LOCATIONS = "classpath:db/migration";

    public StorageProperties {
        if (password == null) {
            password = "";
        }
        if (maxPoolSize == null || maxPoolSize <= 0) {
            maxPoolSize = DEFAULT_MAX_POOL_SIZE;
        }
        if (retryBackoff == null || retryBackoff.isNegative() || retryBackoff.isZero()) {
            retryBackoff = DEFAULT_RETRY_BACKOFF;
        }
        if (connectionTimeout == null || connectionTimeout.isNegative() || connectionTimeout.isZero()) {
            connectionTimeout = DEFAULT_CONNECTION_TIMEOUT;
        }
        if (migrationLocations == null || migrationLocations.isBlank()) {
            migrationLocations = DEFAULT_MIGRATION_LOCATIONS;
        }
    }
}
