package com.bastion.security;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

/**
 * Turns a Basic-Auth token into {@link Credentials}.
 * <p>
 * Every failure is reported as an empty result; nothing here throws for bad input.
 */
public final class CredentialDecoder {

    private static final char SEPARATOR = ':';

    private CredentialDecoder() {
        // utility class
    }

    /**
     * Base64-decodes the token and reads the bytes as UTF-8.
     *
     * @param token the base64 token (may be null)
     * @return the decoded text, or empty for null, invalid base64, or invalid UTF-8
     */
    public static Optional<String> decode(String token) {
        if (token == null) {
            return Optional.empty();
        }
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(token);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        try {
            // a fresh decoder per call: CharsetDecoder is stateful
            return Optional.of(StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString());
        } catch (CharacterCodingException e) {
            return Optional.empty();
        }
    }

    /**
     * Splits {@code email:password} at the first colon.
     *
     * @param decoded the decoded token (may be null)
     * @return the credentials, or empty for null or text without a colon
     */
    public static Optional<Credentials> splitCredentials(String decoded) {
        if (decoded == null) {
            return Optional.empty();
        }
        int colon = decoded.indexOf(SEPARATOR);
        if (colon < 0) {
            return Optional.empty();
        }
        return Optional.of(new Credentials(decoded.substring(0, colon), decoded.substring(colon + 1)));
    }
}
