package com.bastion.security;

import java.util.Optional;

/**
 * Base scheme that protects paths but never resolves an identity: every protected
 * request is refused.
 */
public final class AnonymousAuthenticator implements Authenticator {

    @Override
    public Optional<User> authenticate(String authorizationHeader) {
        return Optional.empty();
    }
}
