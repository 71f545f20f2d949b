package com.strata.platform;

import com.strata.database.StorageConfiguration;
import com.strata.platform.config.StrataProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Import;

/**
 * Strata platform service: tenant and user administration, dataset ingestion and the bridge to
 * the training service.
 *
 * <p>Storage comes from {@link StorageConfiguration}, which replaces Spring Boot's DataSource and
 * Flyway auto-configuration so startup can wait for the database.
 */
@SpringBootApplication
@EnableConfigurationProperties(StrataProperties.class)
@Import(StorageConfiguration.class)
public class PlatformApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlatformApplication.class, args);
    }
}
