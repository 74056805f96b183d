package com.bastion.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * HTTP Basic authentication against a {@link UserDirectory}.
 * <p>
 * The header goes through extract → decode → split → lookup → verify, stopping at the
 * first stage that yields nothing. Malformed or adversarial header input never throws.
 * Which stage failed is logged at DEBUG; credentials are never logged.
 */
public final class BasicAuthenticator implements Authenticator {

    private static final Logger log = LoggerFactory.getLogger(BasicAuthenticator.class);

    private final UserDirectory directory;
    private final CredentialHasher hasher;

    public BasicAuthenticator(UserDirectory directory, CredentialHasher hasher) {
        if (directory == null) {
            throw new IllegalArgumentException("directory must not be null");
        }
        if (hasher == null) {
            throw new IllegalArgumentException("hasher must not be null");
        }
        this.directory = directory;
        this.hasher = hasher;
    }

    @Override
    public Optional<User> authenticate(String authorizationHeader) {
        Optional<String> token = AuthorizationHeaderParser.extractToken(authorizationHeader);
        if (token.isEmpty()) {
            log.debug("Basic auth rejected: no Basic token in header");
            return Optional.empty();
        }
        Optional<String> decoded = CredentialDecoder.decode(token.get());
        if (decoded.isEmpty()) {
            log.debug("Basic auth rejected: token is not base64-encoded UTF-8");
            return Optional.empty();
        }
        Optional<Credentials> credentials = CredentialDecoder.splitCredentials(decoded.get());
        if (credentials.isEmpty()) {
            log.debug("Basic auth rejected: decoded token has no separator");
            return Optional.empty();
        }
        return userFromCredentials(credentials.get());
    }

    /**
     * Looks the email up and verifies the password against the first matching user.
     *
     * @param credentials decoded email and password
     * @return the user if the password matches, otherwise empty (also for credentials holding NUL)
     */
    public Optional<User> userFromCredentials(Credentials credentials) {
        if (credentials == null || credentials.email() == null || credentials.password() == null) {
            return Optional.empty();
        }
        if (containsNul(credentials.email()) || containsNul(credentials.password())) {
            // text columns reject 0x00
            log.debug("Basic auth rejected: credentials contain a NUL character");
            return Optional.empty();
        }
        Optional<User> candidate = directory.findOne(UserFilter.byEmail(credentials.email()));
        if (candidate.isEmpty()) {
            log.debug("Basic auth rejected: no matching user");
            return Optional.empty();
        }
        if (!hasher.verify(credentials.password(), candidate.get().passwordDigest())) {
            log.debug("Basic auth rejected: password mismatch for user {}", candidate.get().id());
            return Optional.empty();
        }
        return candidate;
    }

    private static boolean containsNul(String value) {
        return value.indexOf('\u0000') >= 0;
    }
}
