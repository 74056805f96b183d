package com.bastion.security;

/**
 * One-way, salted password hashing.
 * <p>
 * Digests are self-describing: they embed the algorithm, cost factor and salt, so
 * {@link #verify} needs nothing but the stored digest.
 */
public interface CredentialHasher {

    /**
     * Hashes a password with a fresh random salt. Two calls with the same password
     * return different digests.
     *
     * @param password the plaintext password (must not be null)
     * @return the encoded digest
     * @throws IllegalArgumentException if password is null
     */
    String hash(String password);

    /**
     * Checks a password against a stored digest in constant time.
     *
     * @param password the plaintext password (null never matches)
     * @param digest   a digest produced by {@link #hash(String)}
     * @return true only if the password produced the digest; false for malformed digests
     */
    boolean verify(String password, String digest);
}
