package com.bastion.authservice.config;

import com.bastion.security.BCryptCredentialHasher;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Authentication settings, bound from {@code bastion.auth.*}:
 *
 * <pre>
 * bastion:
 *   auth:
 *     type: basic_auth
 *     excluded-paths:
 *       - /api/v1/status/
 *       - /actuator/*
 *     bcrypt-strength: 12
 * </pre>
 *
 * <p>Excluded paths are exact paths (compared with a trailing slash) or prefixes ending in
 * {@code *}.
 *
 * @param type which scheme guards the API (default {@link AuthType#BASIC_AUTH})
 * @param excludedPaths paths that never require authentication
 * @param bcryptStrength bcrypt cost factor for new password digests (default 10)
 */
@ConfigurationProperties(prefix = "bastion.auth")
@Validated
public record AuthProperties(
        AuthType type,
        List<String> excludedPaths,
        @Min(BCryptCredentialHasher.MIN_STRENGTH) @Max(BCryptCredentialHasher.MAX_STRENGTH)
                Integer bcryptStrength) {

    /** Paths open to anonymous callers unless configured otherwise. */
    public static final List<String> DEFAULT_EXCLUDED_PATHS =
            List.of(
                    "/api/v1/status/",
                    "/api/v1/info/",
                    "/api/v1/unauthorized/",
                    "/api/v1/forbidden/",
                    "/api/v1/users/",
                    "/api/v1/reset_password/",
                    "/actuator/*");

    /** Applies defaults for optional fields. Runs before Bean Validation. */
    public AuthProperties {
        if (type == null) {
            type = AuthType.BASIC_AUTH;
        }
        excludedPaths = excludedPaths == null ? DEFAULT_EXCLUDED_PATHS : List.copyOf(excludedPaths);
        if (bcryptStrength == null) {
            bcryptStrength = BCryptCredentialHasher.DEFAULT_STRENGTH;
        }
    }
}
