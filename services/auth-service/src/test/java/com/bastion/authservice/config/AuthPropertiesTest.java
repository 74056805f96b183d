package com.bastion.authservice.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AuthProperties")
class AuthPropertiesTest {

    @Test
    @DisplayName("defaults to basic_auth, the default exemptions and strength 10")
    void defaults() {
        var props = new AuthProperties(null, null, null);

        assertThat(props.type()).isEqualTo(AuthType.BASIC_AUTH);
        assertThat(props.excludedPaths()).isEqualTo(AuthProperties.DEFAULT_EXCLUDED_PATHS);
        assertThat(props.bcryptStrength()).isEqualTo(10);
    }

    @Test
    @DisplayName("default exemptions open status and registration but not the current user")
    void defaultExemptions() {
        assertThat(AuthProperties.DEFAULT_EXCLUDED_PATHS)
                .contains("/api/v1/status/", "/api/v1/users/", "/actuator/*")
                .doesNotContain("/api/v1/users/me/");
    }

    @Test
    @DisplayName("keeps configured values")
    void keepsConfiguredValues() {
        var props = new AuthProperties(AuthType.NONE, List.of("/open/*"), 12);

        assertThat(props.type()).isEqualTo(AuthType.NONE);
        assertThat(props.excludedPaths()).containsExactly("/open/*");
        assertThat(props.bcryptStrength()).isEqualTo(12);
    }

    @Test
    @DisplayName("an explicitly empty exemption list protects everything")
    void emptyExemptions() {
        assertThat(new AuthProperties(null, List.of(), null).excludedPaths()).isEmpty();
    }
}
