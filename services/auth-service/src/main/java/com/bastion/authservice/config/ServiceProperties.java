package com.bastion.authservice.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Identity of the running service, bound from {@code bastion.service.*}:
 *
 * <pre>
 * bastion:
 *   service:
 *     name: auth-service
 *     environment: production
 *     description: Authentication and user registration
 * </pre>
 *
 * @param name Service name used for logging and metrics. Required.
 * @param environment Deployment environment (development, staging, production).
 * @param description Human-readable service description for {@code /api/v1/info}.
 */
@ConfigurationProperties(prefix = "bastion.service")
@Validated
public record ServiceProperties(@NotBlank String name, String environment, String description) {

    /** Applies defaults for optional fields. Runs before Bean Validation. */
    public ServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (description == null) {
            description = "";
        }
    }
}
