package com.bastion.security;

/**
 * Base class for failures reported by a {@link UserDirectory}.
 */
public class UserDirectoryException extends RuntimeException {

    public UserDirectoryException(String message) {
        super(message);
    }

    public UserDirectoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
