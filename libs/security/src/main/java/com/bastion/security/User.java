package com.bastion.security;

/**
 * A registered user as stored in the {@link UserDirectory}.
 * <p>
 * {@link #toString()} omits the password digest and tokens so a user can be logged safely.
 *
 * @param id             unique identifier assigned by the directory
 * @param email          unique login email
 * @param passwordDigest self-describing digest produced by a {@link CredentialHasher}
 * @param sessionToken   current session token (nullable)
 * @param resetToken     outstanding password-reset token (nullable)
 */
public record User(
        long id,
        String email,
        String passwordDigest,
        String sessionToken,
        String resetToken
) {

    public User {
        if (email == null) {
            throw new IllegalArgumentException("email must not be null");
        }
        if (passwordDigest == null) {
            throw new IllegalArgumentException("passwordDigest must not be null");
        }
    }

    @Override
    public String toString() {
        return "User[id=" + id + ", email=" + email + "]";
    }
}
