package com.bastion.authservice.config;

import com.bastion.observability.MetricFactory;
import com.bastion.security.AnonymousAuthenticator;
import com.bastion.security.Authenticator;
import com.bastion.security.BCryptCredentialHasher;
import com.bastion.security.BasicAuthenticator;
import com.bastion.security.CredentialHasher;
import com.bastion.security.UserDirectory;
import io.micrometer.core.instrument.MeterRegistry;
import java.security.SecureRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Authentication beans. The {@link Authenticator} implementation is chosen from
 * {@code bastion.auth.type}.
 */
@Configuration
public class SecurityConfig {

    private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

    @Bean
    public CredentialHasher credentialHasher(AuthProperties properties) {
        return new BCryptCredentialHasher(properties.bcryptStrength(), new SecureRandom());
    }

    @Bean
    public Authenticator authenticator(
            AuthProperties properties, UserDirectory userDirectory, CredentialHasher credentialHasher) {
        log.info("Authentication scheme: {}", properties.type());
        return switch (properties.type()) {
            case BASIC_AUTH -> new BasicAuthenticator(userDirectory, credentialHasher);
            case AUTH, NONE -> new AnonymousAuthenticator();
        };
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry meterRegistry, ServiceProperties properties) {
        return new MetricFactory(meterRegistry, properties.name());
    }
}
