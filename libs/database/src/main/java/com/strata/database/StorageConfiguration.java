package com.strata.database;

import com.zaxxer.hikari.HikariDataSource;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Storage wiring shared by Strata services.
 *
 * <p>Replaces Spring Boot's DataSource and Flyway auto-configuration: the pool is created by
 * {@link StorageConnector} so startup can wait for the store, and migrations run before any
 * {@link JdbcTemplate} is handed out. Services pull it in with {@code @Import} and should set
 * {@code spring.flyway.enabled=false}.
 */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(StorageProperties.class)
public class StorageConfiguration {

    @Bean(destroyMethod = "close")
    public HikariDataSource dataSource(StorageProperties properties) {
        return new StorageConnector(properties).connect();
    }

    @Bean
    public Flyway flyway(DataSource dataSource, StorageProperties properties) {
        return MigrationService.configure(dataSource, properties.migrationLocations());
    }

    @Bean
    public MigrationService migrationService(Flyway flyway) {
        MigrationService service = new MigrationService(flyway);
        service.migrate();
        return service;
    }

    @Bean
    @DependsOn("migrationService")
    public JdbcTemplate jdbcTemplate(DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    @Bean
    public PlatformTransactionManager transactionManager(DataSource dataSource) {
        return new DataSourceTransactionManager(dataSource);
    }

    @Bean
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }
}
