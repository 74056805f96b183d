package com.bastion.security;

import java.util.Optional;

/**
 * Extracts the credential token from a Basic-Auth {@code Authorization} header value.
 */
public final class AuthorizationHeaderParser {

    /** Scheme prefix, including the single separating space. Matched case-sensitively. */
    public static final String BASIC_PREFIX = "Basic ";

    private AuthorizationHeaderParser() {
        // utility class
    }

    /**
     * Returns everything after {@code "Basic "}, unmodified and untrimmed.
     *
     * @param headerValue the raw header value (may be null)
     * @return the base64 token, or empty if the header is missing or uses another scheme
     */
    public static Optional<String> extractToken(String headerValue) {
        if (headerValue == null || !headerValue.startsWith(BASIC_PREFIX)) {
            return Optional.empty();
        }
        return Optional.of(headerValue.substring(BASIC_PREFIX.length()));
    }
}
