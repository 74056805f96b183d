package com.bastion.database.migration;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized configuration for the user store database.
 *
 * <h2>Configuration Example</h2>
 *
 * <pre>{@code
 * bastion:
 *   database:
 *     url: jdbc:postgresql://localhost:5432/bastion
 *     username: bastion
 *     password: bastion_dev_password
 *     locations: classpath:db/migration/bastion
 *     migrate-on-startup: true
 * }</pre>
 *
 * @param url JDBC connection URL
 * @param username Database username
 * @param password Database password (may be empty for embedded databases)
 * @param locations Flyway migration locations (default {@value #DEFAULT_LOCATIONS})
 * @param migrateOnStartup Whether pending migrations run when the context starts
 */
@Validated
@ConfigurationProperties(prefix = "bastion.database")
public record DatabaseProperties(
        @NotBlank String url,
        @NotBlank String username,
        String password,
        String locations,
        Boolean migrateOnStartup) {

    /** Where the schema migrations of this module live. */
    public static final String DEFAULT_LOCATIONS = "classpath:db/migration/bastion";

    /** Applies defaults for optional fields before Bean Validation runs. */
    public DatabaseProperties {
        if (password == null) {
            password = "";
        }
        if (locations == null || locations.isBlank()) {
            locations = DEFAULT_LOCATIONS;
        }
        if (migrateOnStartup == null) {
            migrateOnStartup = Boolean.TRUE;
        }
    }
}
