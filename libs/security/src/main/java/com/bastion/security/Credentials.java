package com.bastion.security;

/**
 * Email/password pair decoded from a Basic-Auth header. Lives for one authentication attempt.
 *
 * @param email    everything before the first colon, untrimmed
 * @param password everything after the first colon (may itself contain colons)
 */
public record Credentials(String email, String password) {

    @Override
    public String toString() {
        return "Credentials[email=" + email + ", password=****]";
    }
}
