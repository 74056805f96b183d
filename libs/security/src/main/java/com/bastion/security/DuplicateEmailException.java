package com.bastion.security;

/**
 * Thrown when a user with the given email already exists. Registration must reject,
 * never overwrite.
 */
public class DuplicateEmailException extends UserDirectoryException {

    private final String email;

    public DuplicateEmailException(String email) {
        this(email, null);
    }

    public DuplicateEmailException(String email, Throwable cause) {
        super("User " + email + " already exists", cause);
        this.email = email;
    }

    public String email() {
        return email;
    }
}
