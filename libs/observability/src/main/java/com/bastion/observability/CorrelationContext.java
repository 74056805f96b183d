package com.bastion.observability;

/**
 * Immutable correlation context that flows through a single request.
 * <p>
 * Every incoming HTTP request establishes a {@code CorrelationContext}. Its identifiers are
 * echoed back to the client and injected into SLF4J MDC so every log line written while the
 * request is served carries them.
 *
 * @param correlationId unique ID for the business flow (propagated from {@code X-Correlation-ID})
 * @param userId        authenticated user id (null until authentication succeeds)
 * @param requestId     unique ID for this specific request
 */
public record CorrelationContext(
        String correlationId,
        String userId,
        String requestId
) {

    /**
     * MDC key for correlation ID.
     */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /**
     * MDC key for user ID.
     */
    public static final String MDC_USER_ID = "userId";

    /**
     * MDC key for request ID.
     */
    public static final String MDC_REQUEST_ID = "requestId";

    /**
     * Compact constructor: ensures correlationId is never null.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Creates a context carrying only a correlation ID.
     */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null);
    }

    /**
     * Returns a copy of this context attributed to the given user.
     */
    public CorrelationContext withUserId(String userId) {
        return new CorrelationContext(correlationId, userId, requestId);
    }
}
