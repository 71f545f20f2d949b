package com.strata.database;

import java.util.Objects;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfo;
import org.flywaydb.core.api.MigrationInfoService;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies Flyway migrations and reports the resulting schema state.
 *
 * <p>A plain object: tests build it around any {@link Flyway} without a Spring context.
 */
public class MigrationService {

    private static final Logger log = LoggerFactory.getLogger(MigrationService.class);

    /**
     * Migration state of the store.
     *
     * @param appliedMigrations migrations that ran successfully
     * @param pendingMigrations migrations not yet applied
     * @param currentVersion    current schema version, {@code null} before the first migration
     */
    public record DatabaseStatus(int appliedMigrations, int pendingMigrations, String currentVersion) {}

    private final Flyway flyway;

    public MigrationService(Flyway flyway) {
        this.flyway = Objects.requireNonNull(flyway, "flyway must not be null");
    }

    /**
     * Flyway setup used for every Strata store: baseline on first run, {@code clean} disabled.
     */
    public static Flyway configure(DataSource dataSource, String locations) {
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(locations.split("\\s*,\\s*"))
                .baselineOnMigrate(true)
                .cleanDisabled(true)
                .load();
    }

    /**
     * Applies pending migrations and returns how many ran.
     */
    public int migrate() {
        MigrateResult result = flyway.migrate();
        log.info("Applied {} migration(s); schema now at version {}",
                result.migrationsExecuted, result.targetSchemaVersion);
        return result.migrationsExecuted;
    }

    public DatabaseStatus status() {
        MigrationInfoService info = flyway.info();
        int applied = info.applied().length;
        int pending = info.pending().length;
        MigrationInfo current = info.current();
        String version = current == null || current.getVersion() == null
                ? null
                : current.getVersion().getVersion();
        return new DatabaseStatus(applied, pending, version);
    }

    public boolean isUpToDate() {
        return flyway.info().pending().length == 0;
    }
}
