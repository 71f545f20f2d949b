package com.strata.database;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Objects;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the shared connection pool and blocks until the store is reachable.
 *
 * <p>Startup is the only place storage access is retried: attempts repeat with a fixed backoff
 * until one succeeds. Once the pool is up, every request-level failure is terminal.
 */
public class StorageConnector {

    private static final Logger log = LoggerFactory.getLogger(StorageConnector.class);

    static final String POOL_NAME = "strata-storage";

    /** Waits between connection attempts. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final StorageProperties properties;
    private final Sleeper sleeper;

    public StorageConnector(StorageProperties properties) {
        this(properties, duration -> Thread.sleep(duration.toMillis()));
    }

    public StorageConnector(StorageProperties properties, Sleeper sleeper) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    /**
     * Builds the HikariCP pool and waits for the first successful connection.
     */
    public HikariDataSource connect() {
        HikariConfig config = new HikariConfig();
        config.setPoolName(POOL_NAME);
        config.setJdbcUrl(properties.url());
        config.setUsername(properties.username());
        config.setPassword(properties.password());
        config.setMaximumPoolSize(properties.maxPoolSize());
        config.setConnectionTimeout(properties.connectionTimeout().toMillis());
        // let the pool start without a reachable store; awaitAvailable() does the waiting
        config.setInitializationFailTimeout(-1);

        HikariDataSource dataSource = new HikariDataSource(config);
        awaitAvailable(dataSource);
        log.info("Storage pool '{}' ready with up to {} connections", POOL_NAME, dataSource.getMaximumPoolSize());
        return dataSource;
    }

    /**
     * Returns the number of attempts it took to obtain a valid connection.
     *
     * @throws IllegalStateException if the thread is interrupted while waiting
     */
    public int awaitAvailable(DataSource dataSource) {
        int attempt = 0;
        while (true) {
            attempt++;
            try (Connection connection = dataSource.getConnection()) {
                if (connection.isValid((int) Math.max(1, properties.connectionTimeout().toSeconds()))) {
                    if (attempt > 1) {
                        log.info("Storage reachable after {} attempts", attempt);
                    }
                    return attempt;
                }
                log.warn("Storage connection attempt {} returned an invalid connection", attempt);
            } catch (SQLException e) {
                log.warn("Storage connection attempt {} failed: {}; retrying in {}",
                        attempt, e.getMessage(), properties.retryBackoff());
            }
            try {
                sleeper.sleep(properties.retryBackoff());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for storage", e);
            }
        }
    }
}
