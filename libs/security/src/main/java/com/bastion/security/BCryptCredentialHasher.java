package com.bastion.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.security.SecureRandom;

/**
 * {@link CredentialHasher} backed by bcrypt.
 * <p>
 * Digests use the modular crypt format {@code $2a$<cost>$<22 char salt><31 char hash>}.
 * Each doubling of work is one step of {@code strength}.
 */
public final class BCryptCredentialHasher implements CredentialHasher {

    /** Lowest cost bcrypt accepts. */
    public static final int MIN_STRENGTH = 4;

    /** Highest cost bcrypt accepts. */
    public static final int MAX_STRENGTH = 31;

    /** Cost used when none is configured. */
    public static final int DEFAULT_STRENGTH = 10;

    private static final Logger log = LoggerFactory.getLogger(BCryptCredentialHasher.class);

    private final BCryptPasswordEncoder encoder;
    private final int strength;

    /**
     * Creates a hasher with {@link #DEFAULT_STRENGTH} and a new {@link SecureRandom}.
     */
    public BCryptCredentialHasher() {
        this(DEFAULT_STRENGTH, new SecureRandom());
    }

    /**
     * Creates a hasher with the given cost factor.
     *
     * @param strength log2 of the number of rounds, {@value #MIN_STRENGTH}..{@value #MAX_STRENGTH}
     * @param random   salt source
     */
    public BCryptCredentialHasher(int strength, SecureRandom random) {
        if (strength < MIN_STRENGTH || strength > MAX_STRENGTH) {
            throw new IllegalArgumentException(
                    "strength must be between %d and %d, was %d".formatted(MIN_STRENGTH, MAX_STRENGTH, strength));
        }
        if (random == null) {
            throw new IllegalArgumentException("random must not be null");
        }
        this.strength = strength;
        this.encoder = new BCryptPasswordEncoder(BCryptPasswordEncoder.BCryptVersion.$2A, strength, random);
    }

    @Override
    public String hash(String password) {
        if (password == null) {
            throw new IllegalArgumentException("password must not be null");
        }
        return encoder.encode(password);
    }

    @Override
    public boolean verify(String password, String digest) {
        if (password == null || digest == null || digest.isEmpty()) {
            return false;
        }
        try {
            return encoder.matches(password, digest);
        } catch (IllegalArgumentException e) {
            // digest passed the format check but carries an unusable cost or salt
            log.debug("Rejecting malformed password digest: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Returns the configured cost factor.
     */
    public int strength() {
        return strength;
    }
}
