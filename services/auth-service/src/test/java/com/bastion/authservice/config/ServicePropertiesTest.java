package com.bastion.authservice.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ServiceProperties")
class ServicePropertiesTest {

    @Test
    @DisplayName("accepts valid properties")
    void acceptsValidProperties() {
        var props = new ServiceProperties("auth-service", "production", "Authentication");
        assertThat(props.name()).isEqualTo("auth-service");
        assertThat(props.environment()).isEqualTo("production");
        assertThat(props.description()).isEqualTo("Authentication");
    }

    @Test
    @DisplayName("defaults environment to 'development' and description to empty")
    void defaultsWhenNull() {
        var props = new ServiceProperties("auth-service", null, null);
        assertThat(props.environment()).isEqualTo("development");
        assertThat(props.description()).isEmpty();
    }
}
