package com.bastion.authservice;

import com.bastion.authservice.config.AuthProperties;
import com.bastion.authservice.config.ServiceProperties;
import com.bastion.database.migration.UserStoreConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Import;

/**
 * Bastion authentication service.
 *
 * <p>Serves the {@code /api/v1} endpoints behind HTTP Basic authentication. Configured by default
 * with:
 *
 * <ul>
 *   <li>Graceful shutdown ({@code server.shutdown=graceful})
 *   <li>Actuator health, metrics and Prometheus endpoints
 *   <li>Correlation ID propagation into SLF4J MDC
 *   <li>PII redaction in log output
 *   <li>Structured error handling (RFC 7807 ProblemDetail)
 * </ul>
 *
 * <p>The user store schema is migrated by {@link UserStoreConfig}, so Boot's Flyway
 * auto-configuration is excluded.
 */
@SpringBootApplication(exclude = FlywayAutoConfiguration.class)
@EnableConfigurationProperties({ServiceProperties.class, AuthProperties.class})
@Import(UserStoreConfig.class)
public class AuthServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(AuthServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AuthServiceApplication.class, args);
        log.info("Bastion auth service started successfully");
    }
}
