/**
 * Storage plumbing for the Strata platform: connection pooling with startup retry and Flyway
 * schema migrations.
 *
 * <ul>
 *   <li>{@link com.strata.database.StorageProperties}: {@code strata.storage.*} settings
 *   <li>{@link com.strata.database.StorageConnector}: builds the HikariCP pool and waits until the
 *       store accepts connections
 *   <li>{@link com.strata.database.MigrationService}: applies and reports Flyway migrations
 *   <li>{@link com.strata.database.StorageConfiguration}: Spring wiring, imported by services
 * </ul>
 */
package com.strata.database;
