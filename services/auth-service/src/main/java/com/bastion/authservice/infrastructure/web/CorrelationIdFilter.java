package com.bastion.authservice.infrastructure.web;

import com.bastion.observability.CorrelationContext;
import com.bastion.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Propagates or generates a correlation ID for every HTTP request.
 *
 * <p>The ID flows:
 *
 * <ol>
 *   <li>HTTP request header → this filter → {@link CorrelationContextHolder}
 *   <li>CorrelationContextHolder → SLF4J MDC → log output
 *   <li>This filter → HTTP response header
 * </ol>
 *
 * <p>If the client sends {@code X-Correlation-ID} it is reused, otherwise a UUID is generated.
 * Every request also gets a fresh {@code X-Request-ID}.
 * Runs at {@link Ordered#HIGHEST_PRECEDENCE} so the context exists before authentication.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String REQUEST_ID_HEADER = "X-Request-ID";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }

        // one correlation ID may span many requests; the request ID never does
        String requestId = UUID.randomUUID().toString();

        CorrelationContextHolder.set(new CorrelationContext(correlationId, null, requestId));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);
        response.setHeader(REQUEST_ID_HEADER, requestId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Tomcat reuses threads.
            CorrelationContextHolder.clear();
        }
    }
}
