package com.bastion.security;

import java.util.Collection;
import java.util.Optional;

/**
 * An authentication scheme: decides which paths are protected and resolves the caller's
 * identity from the {@code Authorization} header.
 * <p>
 * Schemes are selected by configuration. Every failure to resolve an identity looks the
 * same to the caller: an empty result.
 */
public interface Authenticator {

    /**
     * Returns whether the path needs an authenticated caller.
     * Defaults to {@link PathAuthorizationPolicy#requiresAuth(String, Collection)}.
     */
    default boolean requiresAuth(String path, Collection<String> exemptions) {
        return PathAuthorizationPolicy.requiresAuth(path, exemptions);
    }

    /**
     * Resolves the user behind the header value.
     *
     * @param authorizationHeader raw {@code Authorization} header value (null when absent)
     * @return the authenticated user, or empty
     */
    Optional<User> authenticate(String authorizationHeader);
}
