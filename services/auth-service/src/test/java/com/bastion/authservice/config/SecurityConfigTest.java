package com.bastion.authservice.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.bastion.security.AnonymousAuthenticator;
import com.bastion.security.BCryptCredentialHasher;
import com.bastion.security.BasicAuthenticator;
import com.bastion.security.testing.InMemoryUserDirectory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SecurityConfig")
class SecurityConfigTest {

    private final SecurityConfig config = new SecurityConfig();
    private final InMemoryUserDirectory directory = new InMemoryUserDirectory();

    @Test
    @DisplayName("hasher uses the configured strength")
    void hasherStrength() {
        var hasher = config.credentialHasher(new AuthProperties(null, null, 5));

        assertThat(hasher).isInstanceOf(BCryptCredentialHasher.class);
        assertThat(((BCryptCredentialHasher) hasher).strength()).isEqualTo(5);
    }

    @Test
    @DisplayName("basic_auth selects the basic authenticator")
    void basicAuth() {
        var props = new AuthProperties(AuthType.BASIC_AUTH, null, 4);

        assertThat(config.authenticator(props, directory, config.credentialHasher(props)))
                .isInstanceOf(BasicAuthenticator.class);
    }

    @Test
    @DisplayName("auth and none select the anonymous authenticator")
    void anonymous() {
        for (AuthType type : new AuthType[] {AuthType.AUTH, AuthType.NONE}) {
            var props = new AuthProperties(type, null, 4);

            assertThat(config.authenticator(props, directory, config.credentialHasher(props)))
                    .isInstanceOf(AnonymousAuthenticator.class);
        }
    }
}
