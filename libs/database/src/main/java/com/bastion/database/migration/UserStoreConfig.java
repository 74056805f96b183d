package com.bastion.database.migration;

import com.bastion.database.user.JdbcUserDirectory;
import com.bastion.security.UserDirectory;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * Wires the user store: one {@link DataSource}, a {@link Flyway} instance that migrates it, and
 * the {@link JdbcUserDirectory} on top.
 *
 * <p>Spring Boot's own Flyway auto-configuration must be turned off so migrations run once, from
 * {@link DatabaseProperties#locations()}:
 *
 * <pre>{@code
 * spring:
 *   flyway:
 *     enabled: false
 * }</pre>
 */
@Configuration
@EnableConfigurationProperties(DatabaseProperties.class)
public class UserStoreConfig {

    /** Bean name for the user store Flyway instance. */
    public static final String USER_STORE_FLYWAY_BEAN = "userStoreFlyway";

    private static final Logger log = LoggerFactory.getLogger(UserStoreConfig.class);

    @Bean
    public DataSource userStoreDataSource(DatabaseProperties properties) {
        return DataSourceBuilder.create()
                .url(properties.url())
                .username(properties.username())
                .password(properties.password())
                .build();
    }

    /**
     * Creates the Flyway instance and, when {@code migrate-on-startup} is set, applies pending
     * migrations before any repository bean is created.
     */
    @Bean(name = USER_STORE_FLYWAY_BEAN)
    public Flyway userStoreFlyway(DatabaseProperties properties, DataSource userStoreDataSource) {
        Flyway flyway = createFlyway(userStoreDataSource, properties.locations());
        if (properties.migrateOnStartup()) {
            MigrateResult result = flyway.migrate();
            log.info(
                    "User store migrated: {} migration(s) applied, schema version {}",
                    result.migrationsExecuted,
                    result.targetSchemaVersion);
        }
        return flyway;
    }

    @Bean
    public PlatformTransactionManager userStoreTransactionManager(DataSource userStoreDataSource) {
        return new DataSourceTransactionManager(userStoreDataSource);
    }

    @Bean
    public UserDirectory userDirectory(
            DataSource userStoreDataSource,
            PlatformTransactionManager userStoreTransactionManager,
            Flyway userStoreFlyway) {
        return new JdbcUserDirectory(userStoreDataSource, userStoreTransactionManager);
    }

    /**
     * Creates a Flyway instance for the given datasource. Clean is disabled: the user table is
     * never dropped by tooling.
     */
    public static Flyway createFlyway(DataSource dataSource, String locations) {
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(locations)
                .baselineOnMigrate(true)
                .cleanDisabled(true)
                .load();
    }
}
