package com.bastion.authservice.infrastructure.web;

import com.bastion.authservice.config.AuthProperties;
import com.bastion.authservice.config.AuthType;
import com.bastion.observability.CorrelationContextHolder;
import com.bastion.observability.MetricFactory;
import com.bastion.security.Authenticator;
import com.bastion.security.User;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Timer;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

/**
 * Guards every request with the configured {@link Authenticator}.
 *
 * <p>Outcomes:
 *
 * <ul>
 *   <li>path exempt: passed through untouched
 *   <li>no {@code Authorization} header: 401 with a Basic challenge
 *   <li>header present but no user resolved: 403, whatever the cause
 *   <li>user resolved: stored under {@link #CURRENT_USER_ATTRIBUTE} and passed through
 * </ul>
 *
 * <p>A malformed header, an unknown email and a wrong password all produce the same 403 so the
 * response does not reveal which one it was. Runs right after {@link CorrelationIdFilter}.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class AuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AuthenticationFilter.class);

    /** Request attribute holding the authenticated {@link User}. */
    public static final String CURRENT_USER_ATTRIBUTE = "bastion.currentUser";

    static final String REALM = "bastion";
    static final String METRIC_REQUESTS = "bastion.auth.requests";
    static final String METRIC_DURATION = "bastion.auth.duration";

    private final Authenticator authenticator;
    private final AuthProperties properties;
    private final MetricFactory metrics;
    private final ObjectMapper objectMapper;
    private final Timer authenticationTimer;

    public AuthenticationFilter(
            Authenticator authenticator,
            AuthProperties properties,
            MetricFactory metrics,
            ObjectMapper objectMapper) {
        this.authenticator = authenticator;
        this.properties = properties;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.authenticationTimer =
                metrics.timer(METRIC_DURATION, "Time spent resolving Authorization headers");
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        // CORS preflights carry no credentials.
        return properties.type() == AuthType.NONE
                || HttpMethod.OPTIONS.matches(request.getMethod());
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String path = pathOf(request);
        if (!authenticator.requiresAuth(path, properties.excludedPaths())) {
            record("exempt");
            filterChain.doFilter(request, response);
            return;
        }

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null) {
            record("missing_header");
            log.debug("No Authorization header on {} {}", request.getMethod(), path);
            response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Basic realm=\"" + REALM + "\"");
            reject(response, HttpStatus.UNAUTHORIZED);
            return;
        }

        Timer.Sample sample = Timer.start();
        Optional<User> user = authenticator.authenticate(header);
        sample.stop(authenticationTimer);
        if (user.isEmpty()) {
            record("rejected");
            log.info("Rejected credentials on {} {}", request.getMethod(), path);
            reject(response, HttpStatus.FORBIDDEN);
            return;
        }

        record("authenticated");
        request.setAttribute(CURRENT_USER_ATTRIBUTE, user.get());
        CorrelationContextHolder.attachUser(String.valueOf(user.get().id()));
        filterChain.doFilter(request, response);
    }

    private void reject(HttpServletResponse response, HttpStatus status) throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(
                response.getOutputStream(), Map.of("error", status.getReasonPhrase()));
    }

    private void record(String outcome) {
        metrics.counter(METRIC_REQUESTS, "Authentication decisions by outcome", "outcome", outcome)
                .increment();
    }

    /** Decoded path within the application, without {@code ;} parameters, as MVC matches it. */
    private static String pathOf(HttpServletRequest request) {
        return UrlPathHelper.defaultInstance.getPathWithinApplication(request);
    }
}
